package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.enums.ConfidenceLevel;

/**
 * @param totalValue Σ decision impact, or Σ spend avoided for the spend variant
 * @param count      decisions that contributed
 */
public record ConfidenceResult(
        ConfidenceLevel level,
        double signalRatio,
        double totalSigma,
        double totalValue,
        int count
) {

    public static ConfidenceResult low() {
        return new ConfidenceResult(ConfidenceLevel.LOW, 0.0, 0.0, 0.0, 0);
    }
}
