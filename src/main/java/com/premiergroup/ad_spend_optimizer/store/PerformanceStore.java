package com.premiergroup.ad_spend_optimizer.store;

import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceFilter;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceMetrics;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceUpsert;
import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Weekly performance buckets written by ingestion and read by the optimizer and impact measurement.
 */
public interface PerformanceStore {

    /**
     * Adds the metrics to the bucket for the key, creating it when absent.
     */
    PerformanceRecord upsertPerformance(String accountId, LocalDate weekStart, String campaign, String adGroup,
                                        String target, String matchType, PerformanceMetrics metrics);

    PerformanceRecord upsertPerformance(String accountId, PerformanceUpsert row);

    List<PerformanceRecord> queryPerformance(String accountId, DateRange range, PerformanceFilter filter);

    /**
     * Freshest granular report date for the account, never the aggregated bucket start when a raw date exists.
     */
    Optional<LocalDate> latestRawDate(String accountId);

    List<LocalDate> bucketStarts(String accountId);
}
