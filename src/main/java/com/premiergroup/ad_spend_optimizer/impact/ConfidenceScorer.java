package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.enums.ConfidenceLevel;
import com.premiergroup.ad_spend_optimizer.optimizer.Statistics;

import java.util.List;

/**
 * Signal-to-noise classification over validated decisions. Never alters impact values.
 */
public final class ConfidenceScorer {

    private ConfidenceScorer() {
    }

    public static ConfidenceResult score(List<ImpactRecord> records, ImpactConfig config) {
        List<ImpactRecord> validated = records.stream().filter(ImpactRecord::validated).toList();
        if (validated.isEmpty()) {
            return ConfidenceResult.low();
        }

        double totalImpact = 0.0;
        double absoluteImpact = 0.0;
        double downshiftImpact = 0.0;
        double varianceSum = 0.0;
        for (ImpactRecord record : validated) {
            double impact = record.decisionImpact();
            totalImpact += impact;
            absoluteImpact += Math.abs(impact);

            double sigma = Math.abs(impact) * (1.0 - record.confidenceWeight());
            if (record.downshift()) {
                sigma *= config.getDownshiftSigmaMult();
                downshiftImpact += Math.abs(impact);
            }
            varianceSum += sigma * sigma;
        }

        double totalSigma = varianceSum > 0 ? Math.sqrt(varianceSum) : 0.0;
        double signalRatio = totalSigma > 0 ? Math.abs(totalImpact) / totalSigma : 0.0;

        ConfidenceLevel level;
        if (signalRatio >= config.getHighSignalRatio() && validated.size() >= config.getHighMinCount()) {
            level = ConfidenceLevel.HIGH;
        } else if (signalRatio >= config.getMediumSignalRatio()) {
            level = ConfidenceLevel.MEDIUM;
        } else {
            level = ConfidenceLevel.LOW;
        }
        if (absoluteImpact > 0 && downshiftImpact / absoluteImpact > config.getDownshiftShareLimit()) {
            level = level.downgrade();
        }
        return new ConfidenceResult(level, Statistics.round2(signalRatio), Statistics.round2(totalSigma),
                totalImpact, validated.size());
    }

    /**
     * Spend-avoided variant: fixed auction variance factors instead of per-decision weights.
     */
    public static ConfidenceResult scoreSpendAvoided(List<ImpactRecord> records, ImpactConfig config) {
        double total = 0.0;
        double downshift = 0.0;
        double varianceSum = 0.0;
        int count = 0;
        for (ImpactRecord record : records) {
            if (!record.validated() || record.spendAvoided() <= 0) {
                continue;
            }
            double avoided = record.spendAvoided();
            total += avoided;
            count++;
            double factor = record.downshift()
                    ? config.getSpendAvoidedDownshiftVariance()
                    : config.getSpendAvoidedNormalVariance();
            if (record.downshift()) {
                downshift += avoided;
            }
            double sigma = avoided * factor;
            varianceSum += sigma * sigma;
        }
        if (count == 0) {
            return ConfidenceResult.low();
        }

        double totalSigma = varianceSum > 0 ? Math.sqrt(varianceSum) : 0.0;
        double signalRatio = totalSigma > 0 ? total / totalSigma : 0.0;

        ConfidenceLevel level;
        if (signalRatio >= config.getSpendAvoidedHighRatio() && count >= config.getSpendAvoidedHighMinCount()) {
            level = ConfidenceLevel.HIGH;
        } else if (signalRatio >= config.getSpendAvoidedMediumRatio()) {
            level = ConfidenceLevel.MEDIUM;
        } else {
            level = ConfidenceLevel.LOW;
        }
        if (downshift / total > config.getSpendAvoidedDownshiftShareLimit()) {
            level = level.downgrade();
        }
        return new ConfidenceResult(level, Statistics.round2(signalRatio), Statistics.round2(totalSigma), total, count);
    }
}
