package com.premiergroup.ad_spend_optimizer.enums;

public enum ConfidenceLevel {

    LOW,
    MEDIUM,
    HIGH;

    public ConfidenceLevel downgrade() {
        return switch (this) {
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
        };
    }
}
