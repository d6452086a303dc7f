package com.premiergroup.ad_spend_optimizer.config;

import com.premiergroup.ad_spend_optimizer.impact.ImpactConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "impact")
public class ImpactProperties {

    @Min(0)
    private int maturityBufferDays = 3;
    @Positive
    private int windowPeriods = 2;
    @Positive
    private int fallbackWindowDays = 7;
    private double cadenceTolerance = 0.5;
    @Min(0)
    private int minBeforeClicks = 5;
    @Positive
    private int fullConfidenceClicks = 15;
    private double downshiftSigmaMult = 1.3;
    private double highSignalRatio = 1.5;
    private double mediumSignalRatio = 0.8;
    private int highMinCount = 30;
    private double downshiftShareLimit = 0.4;

    @Valid
    private SpendAvoided spendAvoided = new SpendAvoided();

    @Data
    public static class SpendAvoided {
        private double normalVariance = 0.15;
        private double downshiftVariance = 0.25;
        private double highSignalRatio = 2.0;
        private double mediumSignalRatio = 1.0;
        private int highMinCount = 10;
        private double downshiftShareLimit = 0.3;
    }

    public ImpactConfig toConfig() {
        return ImpactConfig.builder()
                .maturityBufferDays(maturityBufferDays)
                .windowPeriods(windowPeriods)
                .fallbackWindowDays(fallbackWindowDays)
                .cadenceTolerance(cadenceTolerance)
                .minBeforeClicks(minBeforeClicks)
                .fullConfidenceClicks(fullConfidenceClicks)
                .downshiftSigmaMult(downshiftSigmaMult)
                .highSignalRatio(highSignalRatio)
                .mediumSignalRatio(mediumSignalRatio)
                .highMinCount(highMinCount)
                .downshiftShareLimit(downshiftShareLimit)
                .spendAvoidedNormalVariance(spendAvoided.getNormalVariance())
                .spendAvoidedDownshiftVariance(spendAvoided.getDownshiftVariance())
                .spendAvoidedHighRatio(spendAvoided.getHighSignalRatio())
                .spendAvoidedMediumRatio(spendAvoided.getMediumSignalRatio())
                .spendAvoidedHighMinCount(spendAvoided.getHighMinCount())
                .spendAvoidedDownshiftShareLimit(spendAvoided.getDownshiftShareLimit())
                .build();
    }
}
