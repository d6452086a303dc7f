package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;

import java.util.Optional;

/**
 * Assigns each target to exactly one targeting bucket. Precedence is product targeting, category,
 * auto, exact, then broad/phrase; anything else (negative match types, unknown) is not bid on.
 */
public final class BucketClassifier {

    private BucketClassifier() {
    }

    public static Optional<TargetingBucket> classify(PerformanceRecord record) {
        return classify(record.getTargetText(), record.getMatchType());
    }

    public static Optional<TargetingBucket> classify(String targetText, String matchType) {
        String target = TargetingText.normalize(targetText);
        String match = TargetingText.normalize(matchType);

        if (TargetingText.isProductTargeting(target)) {
            return Optional.of(TargetingBucket.PRODUCT_TARGETING);
        }
        if (TargetingText.isCategoryTargeting(target)) {
            return Optional.of(TargetingBucket.CATEGORY);
        }
        if (TargetingText.AUTO_TARGETING_TYPES.contains(target) || match.equals("auto") || match.equals("-")) {
            return Optional.of(TargetingBucket.AUTO);
        }
        if (match.startsWith("negative")) {
            return Optional.empty();
        }
        if (match.contains("exact")) {
            return Optional.of(TargetingBucket.EXACT);
        }
        if (match.contains("broad") || match.contains("phrase")) {
            return Optional.of(TargetingBucket.BROAD_PHRASE);
        }
        return Optional.empty();
    }
}
