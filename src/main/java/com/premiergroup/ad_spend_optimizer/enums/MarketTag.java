package com.premiergroup.ad_spend_optimizer.enums;

public enum MarketTag {

    OFFENSIVE_WIN("Offensive Win"),
    DEFENSIVE_WIN("Defensive Win"),
    GAP("Gap"),
    MARKET_DRAG("Market Drag");

    private final String label;

    MarketTag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Market Drag outcomes would have happened without the decision.
     */
    public boolean isAttributed() {
        return this != MARKET_DRAG;
    }
}
