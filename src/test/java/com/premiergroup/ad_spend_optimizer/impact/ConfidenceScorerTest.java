package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.enums.ConfidenceLevel;
import com.premiergroup.ad_spend_optimizer.enums.MarketTag;
import com.premiergroup.ad_spend_optimizer.enums.ValidationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.premiergroup.ad_spend_optimizer.impact.ImpactRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private static final ImpactConfig CONFIG = ImpactConfig.defaults();

    private static List<ImpactRecord> steady(int count, int downshifted) {
        List<ImpactRecord> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double trend = i < downshifted ? -10 : 10;
            out.add(record(MarketTag.OFFENSIVE_WIN, 10, 0.9, trend, ValidationStatus.CPC_MATCH, true, 0, 100));
        }
        return out;
    }

    @Nested
    @DisplayName("decision impact")
    class DecisionImpact {

        @Test
        @DisplayName("strong signal over enough actions is high")
        void high() {
            ConfidenceResult result = ConfidenceScorer.score(steady(30, 0), CONFIG);

            assertThat(result.level()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(result.count()).isEqualTo(30);
            assertThat(result.totalValue()).isCloseTo(300.0, within(1e-9));
        }

        @Test
        @DisplayName("strong signal over too few actions is medium")
        void mediumOnCount() {
            assertThat(ConfidenceScorer.score(steady(29, 0), CONFIG).level()).isEqualTo(ConfidenceLevel.MEDIUM);
        }

        @Test
        @DisplayName("more than forty percent downshift impact costs one level")
        void downshiftDowngrade() {
            assertThat(ConfidenceScorer.score(steady(30, 13), CONFIG).level()).isEqualTo(ConfidenceLevel.MEDIUM);
            assertThat(ConfidenceScorer.score(steady(30, 12), CONFIG).level()).isEqualTo(ConfidenceLevel.HIGH);
        }

        @Test
        @DisplayName("offsetting impacts have no signal")
        void noise() {
            List<ImpactRecord> records = List.of(
                    record(MarketTag.OFFENSIVE_WIN, 100, 0.2, 10, ValidationStatus.CPC_MATCH, true, 0, 100),
                    record(MarketTag.GAP, -100, 0.2, 10, ValidationStatus.CPC_MATCH, true, 0, 100));

            assertThat(ConfidenceScorer.score(records, CONFIG).level()).isEqualTo(ConfidenceLevel.LOW);
        }

        @Test
        @DisplayName("unvalidated decisions are ignored")
        void unvalidated() {
            List<ImpactRecord> records = List.of(
                    record(MarketTag.OFFENSIVE_WIN, 100, 0.9, 10, ValidationStatus.NOT_IMPLEMENTED, true, 0, 100));

            ConfidenceResult result = ConfidenceScorer.score(records, CONFIG);

            assertThat(result).isEqualTo(ConfidenceResult.low());
        }
    }

    @Nested
    @DisplayName("spend avoided")
    class SpendAvoided {

        private List<ImpactRecord> avoided(int count) {
            List<ImpactRecord> out = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                out.add(record(MarketTag.DEFENSIVE_WIN, 5, 1.0, 10, ValidationStatus.CONFIRMED_BLOCKED, true, 10, 0));
            }
            return out;
        }

        @Test
        void highWithTenActions() {
            ConfidenceResult result = ConfidenceScorer.scoreSpendAvoided(avoided(10), CONFIG);

            assertThat(result.level()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(result.count()).isEqualTo(10);
        }

        @Test
        void mediumWithNine() {
            assertThat(ConfidenceScorer.scoreSpendAvoided(avoided(9), CONFIG).level()).isEqualTo(ConfidenceLevel.MEDIUM);
        }

        @Test
        void zeroSpendAvoidedIsLow() {
            assertThat(ConfidenceScorer.scoreSpendAvoided(steady(30, 0), CONFIG)).isEqualTo(ConfidenceResult.low());
        }
    }
}
