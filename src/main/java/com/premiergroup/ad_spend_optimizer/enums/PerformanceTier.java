package com.premiergroup.ad_spend_optimizer.enums;

/**
 * Position of a target's ROAS relative to its bucket baseline.
 */
public enum PerformanceTier {

    ABOVE_BASELINE,
    AT_BASELINE,
    BELOW_BASELINE,
    UNCLASSIFIED;

    public static PerformanceTier of(double roas, double baseline) {
        if (roas > baseline) {
            return ABOVE_BASELINE;
        }
        if (roas < baseline) {
            return BELOW_BASELINE;
        }
        return AT_BASELINE;
    }
}
