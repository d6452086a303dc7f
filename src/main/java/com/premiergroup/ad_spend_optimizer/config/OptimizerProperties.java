package com.premiergroup.ad_spend_optimizer.config;

import com.premiergroup.ad_spend_optimizer.enums.OptimizationProfile;
import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;
import com.premiergroup.ad_spend_optimizer.exception.OptimizerConfigurationException;
import com.premiergroup.ad_spend_optimizer.optimizer.OptimizerConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Binds {@code optimizer.*}. The first block of thresholds has no defaults: a deployment
 * that omits them fails at startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    @NotNull
    @Positive
    private Double targetRoas;

    @NotNull
    @Positive
    @DecimalMax("1.0")
    private Double upThrottle;

    @NotNull
    @Positive
    @DecimalMax("1.0")
    private Double downThrottle;

    @NotNull
    @Positive
    private Double maxBidChangePct;

    @NotNull
    @Positive
    private Integer harvestClickMin;

    @NotNull
    @Positive
    private Double harvestRoasMult;

    @NotNull
    @Positive
    private Double negativeSoftThreshold;

    @NotNull
    @Positive
    private Double negativeHardThreshold;

    @NotEmpty
    private Map<TargetingBucket, Integer> minClicksPerBucket = new EnumMap<>(TargetingBucket.class);

    private OptimizationProfile profile;

    private double harvestLaunchMult = 1.1;
    private int harvestOrdersFloor = 3;
    private int negativeSoftClickFloor = 10;
    private int negativeHardClickFloor = 15;
    private double bidFloor = 0.30;
    private double minBidMultiplier = 0.5;
    private double maxBidMultiplier = 3.0;
    private double dedupeSimilarity = 0.85;
    private String harvestDestinationPattern = "harvestexact|harvest_exact|_exact_|exactmatch";
    private int lookbackDays = 30;

    @Valid
    private Baseline baseline = new Baseline();

    @Valid
    private Cvr cvr = new Cvr();

    @Valid
    private Visibility visibility = new Visibility();

    @Data
    public static class Baseline {
        private double spendFloor = 5.0;
        @Positive
        @DecimalMax("100.0")
        private double winsorPercentile = 99.0;
        private int minSubstantialRows = 10;
        private int bucketMinRows = 20;
        private double bucketMinSpend = 100.0;
        private double bucketOutlierMult = 1.5;
        private double targetFloorMult = 0.5;
    }

    @Data
    public static class Cvr {
        private double defaultCvr = 0.03;
        @Positive
        private double minCvr = 0.01;
        @Positive
        private double maxCvr = 0.20;
    }

    @Data
    public static class Visibility {
        private double boostPct = 0.30;
        private int minDataDays = 14;
        private int maxImpressions = 100;
    }

    public OptimizerConfig toConfig() {
        required(targetRoas, "target-roas");
        required(upThrottle, "up-throttle");
        required(downThrottle, "down-throttle");
        required(maxBidChangePct, "max-bid-change-pct");
        required(harvestClickMin, "harvest-click-min");
        required(harvestRoasMult, "harvest-roas-mult");
        required(negativeSoftThreshold, "negative-soft-threshold");
        required(negativeHardThreshold, "negative-hard-threshold");
        if (minClicksPerBucket == null || minClicksPerBucket.isEmpty()) {
            throw new OptimizerConfigurationException("Missing required optimizer threshold: min-clicks-per-bucket");
        }

        OptimizerConfig config = OptimizerConfig.builder()
                .targetRoas(targetRoas)
                .upThrottle(upThrottle)
                .downThrottle(downThrottle)
                .maxBidChangePct(maxBidChangePct)
                .harvestClickMin(harvestClickMin)
                .harvestRoasMult(harvestRoasMult)
                .harvestLaunchMult(harvestLaunchMult)
                .harvestOrdersFloor(harvestOrdersFloor)
                .negativeSoftThreshold(negativeSoftThreshold)
                .negativeHardThreshold(negativeHardThreshold)
                .negativeSoftClickFloor(negativeSoftClickFloor)
                .negativeHardClickFloor(negativeHardClickFloor)
                .minClicksPerBucket(new EnumMap<>(minClicksPerBucket))
                .bidFloor(bidFloor)
                .minBidMultiplier(minBidMultiplier)
                .maxBidMultiplier(maxBidMultiplier)
                .dedupeSimilarity(dedupeSimilarity)
                .harvestDestinationPattern(Pattern.compile(harvestDestinationPattern, Pattern.CASE_INSENSITIVE))
                .lookbackDays(lookbackDays)
                .baselineSpendFloor(baseline.getSpendFloor())
                .winsorPercentile(baseline.getWinsorPercentile())
                .minSubstantialRows(baseline.getMinSubstantialRows())
                .bucketMinRows(baseline.getBucketMinRows())
                .bucketMinSpend(baseline.getBucketMinSpend())
                .bucketOutlierMult(baseline.getBucketOutlierMult())
                .targetFloorMult(baseline.getTargetFloorMult())
                .defaultCvr(cvr.getDefaultCvr())
                .minCvr(cvr.getMinCvr())
                .maxCvr(cvr.getMaxCvr())
                .visibilityBoostPct(visibility.getBoostPct())
                .visibilityMinDataDays(visibility.getMinDataDays())
                .visibilityMaxImpressions(visibility.getMaxImpressions())
                .build();
        return profile == null ? config.validate() : profile.applyTo(config).validate();
    }

    private static void required(Object value, String name) {
        if (value == null) {
            throw new OptimizerConfigurationException("Missing required optimizer threshold: " + name);
        }
    }
}
