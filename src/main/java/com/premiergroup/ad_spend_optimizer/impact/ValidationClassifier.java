package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.enums.ValidationStatus;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Looks for after-window evidence that a decision was applied on the ad platform.
 */
public final class ValidationClassifier {

    private ValidationClassifier() {
    }

    /**
     * @param sourceAfter        after-window metrics in the originating campaign (differs from {@code after} only for harvests)
     * @param accountSpendChange fractional account-wide spend change between the two windows
     */
    public static ValidationStatus classify(Decision decision, WindowMetrics before, WindowMetrics after,
                                            WindowMetrics sourceAfter, double accountSpendChange, ImpactConfig config) {
        return switch (decision.getDecisionType()) {
            case BID_CHANGE -> bidChange(decision, before, after, config);
            case NEGATIVE -> negative(before, after, accountSpendChange);
            case HARVEST -> harvest(before, sourceAfter, config);
        };
    }

    static ValidationStatus bidChange(Decision decision, WindowMetrics before, WindowMetrics after, ImpactConfig config) {
        double oldBid = NumberUtils.toDouble(decision.getOldValue(), 0.0);
        double newBid = NumberUtils.toDouble(decision.getNewValue(), 0.0);
        if (oldBid <= 0 || newBid <= 0 || after.clicks() == 0) {
            return ValidationStatus.UNVERIFIED;
        }
        boolean bidUp = newBid > oldBid;

        double afterCpc = after.cpc();
        if (Math.abs(afterCpc - newBid) / newBid <= config.getCpcMatchTolerance()) {
            return ValidationStatus.CPC_MATCH;
        }

        // free clicks give no CPC to compare against
        if (before.clicks() > 0 && before.spend() > 0) {
            double cpcChange = (afterCpc - before.cpc()) / before.cpc();
            if ((bidUp && cpcChange > config.getCpcDirectionalThreshold())
                    || (!bidUp && cpcChange < -config.getCpcDirectionalThreshold())) {
                return ValidationStatus.CPC_DIRECTIONAL;
            }
        }

        if (before.impressions() >= config.getMinImpressionsBefore()) {
            double impressionChange = (double) (after.impressions() - before.impressions()) / before.impressions();
            if ((bidUp && impressionChange >= config.getImpressionsUpThreshold())
                    || (!bidUp && impressionChange <= -config.getImpressionsDownThreshold())) {
                return ValidationStatus.VOLUME_MATCH;
            }
        }
        return before.clicks() > 0 ? ValidationStatus.DIRECTION_MISMATCH : ValidationStatus.UNVERIFIED;
    }

    static ValidationStatus negative(WindowMetrics before, WindowMetrics after, double accountSpendChange) {
        if (!before.hasData()) {
            return ValidationStatus.UNVERIFIED;
        }
        if (before.spend() <= 0) {
            return ValidationStatus.PREVENTATIVE;
        }
        if (after.spend() <= 0) {
            return ValidationStatus.CONFIRMED_BLOCKED;
        }
        double spendChange = after.spend() / before.spend() - 1.0;
        double threshold = Math.min(accountSpendChange - 0.5, -0.95);
        return spendChange <= threshold ? ValidationStatus.NORMALIZED_BLOCK : ValidationStatus.NOT_IMPLEMENTED;
    }

    static ValidationStatus harvest(WindowMetrics sourceBefore, WindowMetrics sourceAfter, ImpactConfig config) {
        if (sourceBefore.spend() < config.getHarvestMinSourceSpend()) {
            return ValidationStatus.UNVERIFIED;
        }
        if (sourceAfter.spend() <= 0) {
            return ValidationStatus.HARVEST_COMPLETE;
        }
        double drop = 1.0 - sourceAfter.spend() / sourceBefore.spend();
        if (drop >= config.getHarvestNearComplete()) {
            return ValidationStatus.HARVEST_NEAR_COMPLETE;
        }
        if (drop >= config.getHarvestMigrated()) {
            return ValidationStatus.HARVEST_MIGRATED;
        }
        if (drop >= config.getHarvestPartial()) {
            return ValidationStatus.HARVEST_PARTIAL;
        }
        return ValidationStatus.HARVEST_INCOMPLETE;
    }
}
