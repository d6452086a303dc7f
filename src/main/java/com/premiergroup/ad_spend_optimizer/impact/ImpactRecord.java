package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.enums.ConfidenceLevel;
import com.premiergroup.ad_spend_optimizer.enums.DecisionType;
import com.premiergroup.ad_spend_optimizer.enums.MarketTag;
import com.premiergroup.ad_spend_optimizer.enums.ValidationStatus;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Measured outcome of one logged decision. Recomputed on every read.
 */
public record ImpactRecord(
        UUID decisionId,
        DecisionType decisionType,
        String targetText,
        String campaignName,
        LocalDate decisionDate,
        WindowMetrics before,
        WindowMetrics after,
        double expectedAfterClicks,
        double expectedAfterSales,
        double expectedTrendPct,
        double actualChangePct,
        double decisionValuePct,
        double decisionImpact,
        MarketTag marketTag,
        boolean mature,
        ValidationStatus validationStatus,
        double confidenceWeight,
        ConfidenceLevel confidence,
        boolean guardrailed,
        double spendAvoided,
        int windowDays,
        boolean windowFallback
) {

    public boolean validated() {
        return validationStatus.isValidated();
    }

    /**
     * Market was already moving down: expected trend below zero.
     */
    public boolean downshift() {
        return expectedTrendPct < 0;
    }
}
