package com.premiergroup.ad_spend_optimizer.enums;

public enum ImpactHorizon {

    DAYS_14(14),
    DAYS_30(30),
    DAYS_60(60);

    private final int days;

    ImpactHorizon(int days) {
        this.days = days;
    }

    public int getDays() {
        return days;
    }
}
