package com.premiergroup.ad_spend_optimizer.impact;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ImpactConfig {

    @Builder.Default
    int maturityBufferDays = 3;
    @Builder.Default
    int windowPeriods = 2;
    @Builder.Default
    int fallbackWindowDays = 7;
    @Builder.Default
    double cadenceTolerance = 0.5;

    @Builder.Default
    int minBeforeClicks = 5;
    @Builder.Default
    int fullConfidenceClicks = 15;

    @Builder.Default
    double downshiftSigmaMult = 1.3;
    @Builder.Default
    double highSignalRatio = 1.5;
    @Builder.Default
    double mediumSignalRatio = 0.8;
    @Builder.Default
    int highMinCount = 30;
    @Builder.Default
    double downshiftShareLimit = 0.4;

    @Builder.Default
    double spendAvoidedNormalVariance = 0.15;
    @Builder.Default
    double spendAvoidedDownshiftVariance = 0.25;
    @Builder.Default
    double spendAvoidedHighRatio = 2.0;
    @Builder.Default
    double spendAvoidedMediumRatio = 1.0;
    @Builder.Default
    int spendAvoidedHighMinCount = 10;
    @Builder.Default
    double spendAvoidedDownshiftShareLimit = 0.3;

    @Builder.Default
    double cpcMatchTolerance = 0.20;
    @Builder.Default
    double cpcDirectionalThreshold = 0.03;
    @Builder.Default
    int minImpressionsBefore = 20;
    @Builder.Default
    double impressionsUpThreshold = 0.15;
    @Builder.Default
    double impressionsDownThreshold = 0.10;

    @Builder.Default
    double harvestNearComplete = 0.90;
    @Builder.Default
    double harvestMigrated = 0.75;
    @Builder.Default
    double harvestPartial = 0.50;
    @Builder.Default
    double harvestMinSourceSpend = 5.0;

    public static ImpactConfig defaults() {
        return ImpactConfig.builder().build();
    }
}
