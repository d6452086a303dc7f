package com.premiergroup.ad_spend_optimizer.enums;

import com.premiergroup.ad_spend_optimizer.optimizer.OptimizerConfig;

/**
 * Presets that move throttles and harvest/negative multipliers together.
 */
public enum OptimizationProfile {

    AGGRESSIVE(0.70, 0.70, 0.75, 1.2, 2.5),
    BALANCED(0.50, 0.50, 0.85, 1.5, 3.0),
    CONSERVATIVE(0.30, 0.30, 0.95, 2.0, 4.0);

    private final double upThrottle;
    private final double downThrottle;
    private final double harvestRoasMult;
    private final double negativeSoftThreshold;
    private final double negativeHardThreshold;

    OptimizationProfile(double upThrottle, double downThrottle, double harvestRoasMult,
                        double negativeSoftThreshold, double negativeHardThreshold) {
        this.upThrottle = upThrottle;
        this.downThrottle = downThrottle;
        this.harvestRoasMult = harvestRoasMult;
        this.negativeSoftThreshold = negativeSoftThreshold;
        this.negativeHardThreshold = negativeHardThreshold;
    }

    public OptimizerConfig applyTo(OptimizerConfig config) {
        return config.toBuilder()
                .upThrottle(upThrottle)
                .downThrottle(downThrottle)
                .harvestRoasMult(harvestRoasMult)
                .negativeSoftThreshold(negativeSoftThreshold)
                .negativeHardThreshold(negativeHardThreshold)
                .build();
    }
}
