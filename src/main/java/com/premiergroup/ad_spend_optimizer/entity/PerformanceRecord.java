package com.premiergroup.ad_spend_optimizer.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * One calendar week of metrics for a target. Metrics of repeated uploads for the same key are summed.
 */
@Entity
@Table(name = "performance_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_performance_key", columnNames = {
                "account_id", "week_start", "campaign_name", "ad_group_name", "target_text", "search_term", "match_type"}),
        indexes = @Index(name = "idx_performance_account_week", columnList = "account_id, week_start"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class PerformanceRecord {

    public static final int BUCKET_DAYS = 7;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Column(name = "campaign_name", nullable = false)
    private String campaignName;

    @Column(name = "ad_group_name", nullable = false)
    private String adGroupName;

    @Column(name = "target_text", nullable = false)
    private String targetText;

    @Builder.Default
    @Column(name = "search_term", nullable = false)
    private String searchTerm = "";

    @Column(name = "match_type", nullable = false)
    private String matchType;

    @Builder.Default
    private BigDecimal spend = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal sales = BigDecimal.ZERO;
    @Builder.Default
    private Integer clicks = 0;
    @Builder.Default
    private Integer impressions = 0;
    @Builder.Default
    private Integer orders = 0;

    @Column(name = "last_report_date")
    private LocalDate lastReportDate;

    @Column(name = "ingested_at")
    private Instant ingestedAt;

    // ingestion date capped at the bucket's last day
    @Column(name = "ingested_through")
    private LocalDate ingestedThrough;

    public double spendValue() {
        return spend == null ? 0.0 : spend.doubleValue();
    }

    public double salesValue() {
        return sales == null ? 0.0 : sales.doubleValue();
    }

    public int clickCount() {
        return clicks == null ? 0 : clicks;
    }

    public int impressionCount() {
        return impressions == null ? 0 : impressions;
    }

    public int orderCount() {
        return orders == null ? 0 : orders;
    }

    /**
     * Latest raw report date behind this bucket. Uploads without one fall back to the day they were ingested.
     */
    public LocalDate reportDate() {
        if (lastReportDate != null) {
            return lastReportDate;
        }
        return ingestedThrough != null ? ingestedThrough : weekStart;
    }

    public void markIngested(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        LocalDate bucketEnd = weekStart.plusDays(BUCKET_DAYS - 1);
        ingestedAt = now;
        ingestedThrough = today.isAfter(bucketEnd) ? bucketEnd : today;
    }
}
