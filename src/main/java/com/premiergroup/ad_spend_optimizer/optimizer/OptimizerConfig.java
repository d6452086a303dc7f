package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;
import com.premiergroup.ad_spend_optimizer.exception.OptimizerConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable thresholds for one optimizer run.
 */
@Value
@Builder(toBuilder = true)
public class OptimizerConfig {

    double targetRoas;
    double upThrottle;
    double downThrottle;
    double maxBidChangePct;

    int harvestClickMin;
    double harvestRoasMult;
    @Builder.Default
    double harvestLaunchMult = 1.1;
    @Builder.Default
    int harvestOrdersFloor = 3;

    double negativeSoftThreshold;
    double negativeHardThreshold;
    @Builder.Default
    int negativeSoftClickFloor = 10;
    @Builder.Default
    int negativeHardClickFloor = 15;

    Map<TargetingBucket, Integer> minClicksPerBucket;

    @Builder.Default
    double bidFloor = 0.30;
    @Builder.Default
    double minBidMultiplier = 0.5;
    @Builder.Default
    double maxBidMultiplier = 3.0;

    @Builder.Default
    double dedupeSimilarity = 0.85;
    @Builder.Default
    Pattern harvestDestinationPattern = Pattern.compile("harvestexact|harvest_exact|_exact_|exactmatch",
            Pattern.CASE_INSENSITIVE);
    @Builder.Default
    int lookbackDays = 30;

    @Builder.Default
    double baselineSpendFloor = 5.0;
    @Builder.Default
    double winsorPercentile = 99.0;
    @Builder.Default
    int minSubstantialRows = 10;
    @Builder.Default
    int bucketMinRows = 20;
    @Builder.Default
    double bucketMinSpend = 100.0;
    @Builder.Default
    double bucketOutlierMult = 1.5;
    @Builder.Default
    double targetFloorMult = 0.5;

    @Builder.Default
    double defaultCvr = 0.03;
    @Builder.Default
    double minCvr = 0.01;
    @Builder.Default
    double maxCvr = 0.20;

    @Builder.Default
    double visibilityBoostPct = 0.30;
    @Builder.Default
    int visibilityMinDataDays = 14;
    @Builder.Default
    int visibilityMaxImpressions = 100;

    public int minClicks(TargetingBucket bucket) {
        Integer min = minClicksPerBucket == null ? null : minClicksPerBucket.get(bucket);
        if (min == null) {
            throw new OptimizerConfigurationException("No minimum click count configured for bucket " + bucket);
        }
        return min;
    }

    /**
     * Rejects configurations that would make the bid formula or thresholds meaningless.
     */
    public OptimizerConfig validate() {
        require(targetRoas > 0, "target-roas must be positive");
        require(upThrottle > 0 && upThrottle <= 1, "up-throttle must be in (0, 1]");
        require(downThrottle > 0 && downThrottle <= 1, "down-throttle must be in (0, 1]");
        require(maxBidChangePct > 0, "max-bid-change-pct must be positive");
        require(harvestClickMin > 0, "harvest-click-min must be positive");
        require(harvestRoasMult > 0, "harvest-roas-mult must be positive");
        require(negativeSoftThreshold > 0, "negative-soft-threshold must be positive");
        require(negativeHardThreshold >= negativeSoftThreshold,
                "negative-hard-threshold must not be below negative-soft-threshold");
        require(minBidMultiplier > 0 && minBidMultiplier <= maxBidMultiplier,
                "min-bid-multiplier must be positive and not above max-bid-multiplier");
        require(winsorPercentile > 0 && winsorPercentile <= 100, "winsor-percentile must be in (0, 100]");
        require(minCvr > 0 && minCvr <= maxCvr, "cvr bounds are inconsistent");
        if (minClicksPerBucket == null) {
            throw new OptimizerConfigurationException("min-clicks-per-bucket is required");
        }
        for (TargetingBucket bucket : TargetingBucket.values()) {
            require(minClicks(bucket) >= 0, "min-clicks-per-bucket." + bucket + " must not be negative");
        }
        return this;
    }

    public static Map<TargetingBucket, Integer> defaultMinClicks() {
        Map<TargetingBucket, Integer> map = new EnumMap<>(TargetingBucket.class);
        map.put(TargetingBucket.EXACT, 5);
        map.put(TargetingBucket.PRODUCT_TARGETING, 5);
        map.put(TargetingBucket.BROAD_PHRASE, 8);
        map.put(TargetingBucket.AUTO, 8);
        map.put(TargetingBucket.CATEGORY, 10);
        return map;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new OptimizerConfigurationException(message);
        }
    }
}
