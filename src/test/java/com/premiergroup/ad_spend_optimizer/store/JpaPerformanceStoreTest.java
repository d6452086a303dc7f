package com.premiergroup.ad_spend_optimizer.store;

import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceFilter;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceMetrics;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceUpsert;
import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaPerformanceStore.class)
class JpaPerformanceStoreTest {

    private static final String ACCOUNT = "acme";
    private static final LocalDate WEEK = LocalDate.of(2026, 3, 2);

    @Autowired
    private PerformanceStore performanceStore;

    private static PerformanceMetrics metrics(String spend, String sales, int clicks, LocalDate reportDate) {
        return new PerformanceMetrics(new BigDecimal(spend), new BigDecimal(sales), clicks, clicks * 20, 1, reportDate);
    }

    @Test
    @DisplayName("repeated uploads for one key are summed")
    void additiveUpsert() {
        performanceStore.upsertPerformance(ACCOUNT, WEEK, "Brand", "AG", "shoes", "exact",
                metrics("10.00", "30.00", 5, WEEK.plusDays(2)));
        performanceStore.upsertPerformance(ACCOUNT, WEEK, " Brand ", "AG", "shoes", "exact",
                metrics("2.50", "0", 1, WEEK.plusDays(1)));

        List<PerformanceRecord> rows = performanceStore.queryPerformance(ACCOUNT, DateRange.endingAt(WEEK, 7),
                PerformanceFilter.none());

        assertThat(rows).hasSize(1);
        PerformanceRecord row = rows.get(0);
        assertThat(row.getSpend()).isEqualByComparingTo("12.50");
        assertThat(row.getSales()).isEqualByComparingTo("30.00");
        assertThat(row.getClicks()).isEqualTo(6);
        assertThat(row.getImpressions()).isEqualTo(120);
        assertThat(row.getOrders()).isEqualTo(2);
        assertThat(row.getLastReportDate()).isEqualTo(WEEK.plusDays(2));
    }

    @Test
    @DisplayName("search-term rows are distinct from target rows")
    void searchTermKey() {
        performanceStore.upsertPerformance(ACCOUNT, WEEK, "Broad", "AG", "shoes", "broad",
                metrics("10", "0", 5, null));
        performanceStore.upsertPerformance(ACCOUNT, new PerformanceUpsert(WEEK, "Broad", "AG", "shoes", "red shoes",
                "broad", new BigDecimal("4"), new BigDecimal("12"), 2, 40, 1, null));

        assertThat(performanceStore.queryPerformance(ACCOUNT, DateRange.endingAt(WEEK, 7), PerformanceFilter.none()))
                .extracting(PerformanceRecord::getSearchTerm)
                .containsExactlyInAnyOrder("", "red shoes");
    }

    @Test
    @DisplayName("latest raw date prefers report dates over the ingestion fallback")
    void latestRawDate() {
        assertThat(performanceStore.latestRawDate(ACCOUNT)).isEmpty();

        performanceStore.upsertPerformance(ACCOUNT, WEEK, "Brand", "AG", "shoes", "exact",
                metrics("1", "1", 1, WEEK.plusDays(5)));
        assertThat(performanceStore.latestRawDate(ACCOUNT)).contains(WEEK.plusDays(5));

        performanceStore.upsertPerformance(ACCOUNT, WEEK.plusWeeks(1), "Brand", "AG", "shoes", "exact",
                metrics("1", "1", 1, null));
        // a past bucket uploaded without a report date is complete through its last day
        assertThat(performanceStore.latestRawDate(ACCOUNT)).contains(WEEK.plusWeeks(1).plusDays(6));
    }

    @Test
    @DisplayName("a current bucket without a report date counts as fresh through the ingestion day")
    void ingestionFallback() {
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        PerformanceRecord record = performanceStore.upsertPerformance(ACCOUNT, today.minusDays(2), "Brand", "AG",
                "shoes", "exact", metrics("1", "1", 1, null));

        assertThat(record.getIngestedAt()).isNotNull();
        assertThat(record.reportDate()).isEqualTo(today);
        assertThat(performanceStore.latestRawDate(ACCOUNT)).contains(today);
    }

    @Test
    @DisplayName("queries are scoped by account, window and filter")
    void scopedQuery() {
        performanceStore.upsertPerformance(ACCOUNT, WEEK, "Brand", "AG", "shoes", "exact", metrics("1", "1", 1, null));
        performanceStore.upsertPerformance(ACCOUNT, WEEK, "Generic", "AG", "shoes", "broad", metrics("1", "1", 1, null));
        performanceStore.upsertPerformance(ACCOUNT, WEEK.minusWeeks(2), "Brand", "AG", "shoes", "exact", metrics("1", "1", 1, null));
        performanceStore.upsertPerformance("other", WEEK, "Brand", "AG", "shoes", "exact", metrics("1", "1", 1, null));

        List<PerformanceRecord> rows = performanceStore.queryPerformance(ACCOUNT, DateRange.endingAt(WEEK, 7),
                new PerformanceFilter(Set.of("brand"), Set.of()));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getCampaignName()).isEqualTo("Brand");
        assertThat(performanceStore.bucketStarts(ACCOUNT)).containsExactly(WEEK.minusWeeks(2), WEEK);
    }
}
