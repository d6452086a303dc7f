package com.premiergroup.ad_spend_optimizer.service;

import com.premiergroup.ad_spend_optimizer.config.ImpactProperties;
import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.enums.*;
import com.premiergroup.ad_spend_optimizer.impact.ImpactFilter;
import com.premiergroup.ad_spend_optimizer.impact.ImpactRecord;
import com.premiergroup.ad_spend_optimizer.impact.ImpactSummary;
import com.premiergroup.ad_spend_optimizer.store.DecisionLog;
import com.premiergroup.ad_spend_optimizer.store.PerformanceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImpactServiceTest {

    private static final String ACCOUNT = "acme";
    private static final LocalDate DECIDED = LocalDate.of(2026, 3, 2);

    @Mock
    private PerformanceStore performanceStore;

    @Mock
    private DecisionLog decisionLog;

    private ImpactService impactService;
    private final List<PerformanceRecord> rows = new ArrayList<>();

    @BeforeEach
    void setUp() {
        impactService = new ImpactService(performanceStore, decisionLog, new ImpactProperties());
    }

    private static PerformanceRecord row(LocalDate week, String campaign, String target, String searchTerm,
                                         String matchType, double spend, double sales, int clicks, int impressions) {
        return PerformanceRecord.builder()
                .accountId(ACCOUNT)
                .weekStart(week)
                .campaignName(campaign)
                .adGroupName("AG")
                .targetText(target)
                .searchTerm(searchTerm)
                .matchType(matchType)
                .spend(BigDecimal.valueOf(spend))
                .sales(BigDecimal.valueOf(sales))
                .clicks(clicks)
                .impressions(impressions)
                .orders(1)
                .build();
    }

    private static Decision bidDown() {
        return Decision.builder()
                .decisionId(UUID.randomUUID())
                .decisionType(DecisionType.BID_CHANGE)
                .decisionDate(DECIDED)
                .targetText("shoes")
                .campaignName("Brand")
                .adGroupName("AG")
                .oldValue("1.00")
                .newValue("0.80")
                .build();
    }

    private void givenBidDownHistory(LocalDate latestRaw, boolean secondAfterWeek) {
        rows.add(row(DECIDED.minusWeeks(2), "Brand", "shoes", "", "exact", 50, 150, 10, 1000));
        rows.add(row(DECIDED.minusWeeks(1), "Brand", "shoes", "", "exact", 50, 150, 10, 1000));
        rows.add(row(DECIDED, "Brand", "shoes", "", "exact", 25, 100, 5, 800));
        if (secondAfterWeek) {
            rows.add(row(DECIDED.plusWeeks(1), "Brand", "shoes", "", "exact", 25, 100, 5, 800));
        }
        when(decisionLog.queryDecisions(ACCOUNT, null, Set.of())).thenReturn(List.of(bidDown()));
        when(performanceStore.latestRawDate(ACCOUNT)).thenReturn(Optional.of(latestRaw));
        when(performanceStore.queryPerformance(eq(ACCOUNT), any(DateRange.class), any())).thenReturn(rows);
    }

    @Nested
    @DisplayName("per-decision impact")
    class Actions {

        @Test
        @DisplayName("bid down in a shrinking market is a validated defensive win")
        void defensiveWin() {
            givenBidDownHistory(LocalDate.of(2026, 3, 31), true);

            List<ImpactRecord> records = impactService.getActionImpact(ACCOUNT, 14, 14);

            assertThat(records).hasSize(1);
            ImpactRecord record = records.get(0);
            assertThat(record.before().spend()).isEqualTo(100.0);
            assertThat(record.after().spend()).isEqualTo(50.0);
            assertThat(record.expectedAfterSales()).isCloseTo(150.0, within(1e-9));
            assertThat(record.decisionImpact()).isCloseTo(50.0, within(1e-9));
            assertThat(record.marketTag()).isEqualTo(MarketTag.DEFENSIVE_WIN);
            assertThat(record.mature()).isTrue();
            assertThat(record.validationStatus()).isEqualTo(ValidationStatus.VOLUME_MATCH);
            assertThat(record.spendAvoided()).isCloseTo(50.0, within(1e-9));
            assertThat(record.confidence()).isEqualTo(ConfidenceLevel.HIGH);
        }

        @Test
        @DisplayName("partially covered after window rescales the before window")
        void partialCoverage() {
            givenBidDownHistory(LocalDate.of(2026, 3, 8), false);

            ImpactRecord record = impactService.getActionImpact(ACCOUNT, 14, 14).get(0);

            assertThat(record.mature()).isFalse();
            assertThat(record.expectedAfterSales()).isCloseTo(75.0, within(1e-9));
            assertThat(record.decisionImpact()).isCloseTo(25.0, within(1e-9));
            assertThat(record.guardrailed()).isFalse();
        }

        @Test
        @DisplayName("harvest is judged on the new campaign and validated on the source")
        void harvest() {
            Decision harvest = Decision.builder()
                    .decisionId(UUID.randomUUID())
                    .decisionType(DecisionType.HARVEST)
                    .decisionDate(DECIDED)
                    .targetText("blue running shoes")
                    .campaignName("Disc B")
                    .adGroupName("AG")
                    .oldValue("1.00")
                    .newValue("1.10")
                    .winnerSourceCampaign("Disc B")
                    .newCampaignName("Harvest_Exact_Disc B")
                    .build();
            rows.add(row(DECIDED.minusWeeks(1), "Disc B", "shoes", "blue running shoes", "broad", 40, 160, 20, 900));
            rows.add(row(DECIDED, "Harvest_Exact_Disc B", "blue running shoes", "", "exact", 30, 150, 15, 700));
            when(decisionLog.queryDecisions(ACCOUNT, null, Set.of())).thenReturn(List.of(harvest));
            when(performanceStore.latestRawDate(ACCOUNT)).thenReturn(Optional.of(LocalDate.of(2026, 3, 31)));
            when(performanceStore.queryPerformance(eq(ACCOUNT), any(DateRange.class), any())).thenReturn(rows);

            ImpactRecord record = impactService.getActionImpact(ACCOUNT, 14, 14).get(0);

            assertThat(record.before().spend()).isEqualTo(40.0);
            assertThat(record.after().spend()).isEqualTo(30.0);
            assertThat(record.validationStatus()).isEqualTo(ValidationStatus.HARVEST_COMPLETE);
            assertThat(record.spendAvoided()).isZero();
        }

        @Test
        @DisplayName("negative with no spend afterwards is confirmed blocked")
        void negative() {
            Decision negative = Decision.builder()
                    .decisionId(UUID.randomUUID())
                    .decisionType(DecisionType.NEGATIVE)
                    .decisionDate(DECIDED)
                    .targetText("cheap shoes")
                    .campaignName("Generic")
                    .adGroupName("AG")
                    .oldValue("ENABLED")
                    .newValue("PAUSED")
                    .build();
            rows.add(row(DECIDED.minusWeeks(1), "Generic", "shoes", "cheap shoes", "broad", 20, 0, 30, 900));
            rows.add(row(DECIDED, "Generic", "shoes", "other shoes", "broad", 20, 60, 30, 900));
            when(decisionLog.queryDecisions(ACCOUNT, null, Set.of())).thenReturn(List.of(negative));
            when(performanceStore.latestRawDate(ACCOUNT)).thenReturn(Optional.of(LocalDate.of(2026, 3, 31)));
            when(performanceStore.queryPerformance(eq(ACCOUNT), any(DateRange.class), any())).thenReturn(rows);

            ImpactRecord record = impactService.getActionImpact(ACCOUNT, 14, 14).get(0);

            assertThat(record.validationStatus()).isEqualTo(ValidationStatus.CONFIRMED_BLOCKED);
            assertThat(record.spendAvoided()).isCloseTo(20.0, within(1e-9));
        }

        @Test
        @DisplayName("no decisions means nothing to measure")
        void empty() {
            when(decisionLog.queryDecisions(ACCOUNT, null, Set.of())).thenReturn(List.of());

            assertThat(impactService.getActionImpact(ACCOUNT, 14, 14)).isEmpty();
        }

        @Test
        void rejectsNonPositiveWindows() {
            assertThatThrownBy(() -> impactService.getActionImpact(ACCOUNT, 0, 14))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("summary")
    class Summary {

        @BeforeEach
        void cadence() {
            when(performanceStore.bucketStarts(ACCOUNT)).thenReturn(List.of(DECIDED.minusWeeks(2),
                    DECIDED.minusWeeks(1), DECIDED, DECIDED.plusWeeks(1)));
        }

        @Test
        @DisplayName("windows follow the weekly cadence")
        void cadenceWindows() {
            givenBidDownHistory(LocalDate.of(2026, 3, 31), true);

            ImpactSummary summary = impactService.getImpactSummary(ACCOUNT, ImpactFilter.defaults(), null);

            assertThat(summary.beforeDays()).isEqualTo(14);
            assertThat(summary.windowFallback()).isFalse();
            assertThat(summary.totalActions()).isEqualTo(1);
            assertThat(summary.defensiveWins()).isEqualTo(1);
            assertThat(summary.attributedImpact()).isCloseTo(50.0, within(1e-9));
            assertThat(summary.spendAvoided()).isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("a longer horizon leaves the decision pending")
        void horizonNotElapsed() {
            givenBidDownHistory(LocalDate.of(2026, 3, 31), true);

            ImpactSummary summary = impactService.getImpactSummary(ACCOUNT, ImpactFilter.defaults(),
                    ImpactHorizon.DAYS_30);

            assertThat(summary.afterDays()).isEqualTo(30);
            assertThat(summary.totalActions()).isZero();
            assertThat(summary.pendingActions()).isEqualTo(1);
        }
    }
}
