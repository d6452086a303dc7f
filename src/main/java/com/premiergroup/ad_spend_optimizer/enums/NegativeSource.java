package com.premiergroup.ad_spend_optimizer.enums;

public enum NegativeSource {

    ISOLATION("Isolation"),
    BLEEDER("Performance"),
    BLEEDER_HARD_STOP("Hard Stop"),
    COMPETITOR_ASIN("Competitor ASIN"),
    CONSOLIDATION("Consolidation");

    private final String label;

    NegativeSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
