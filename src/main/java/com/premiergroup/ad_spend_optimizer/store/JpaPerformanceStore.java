package com.premiergroup.ad_spend_optimizer.store;

import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceFilter;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceMetrics;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceUpsert;
import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.exception.PerformanceDataException;
import com.premiergroup.ad_spend_optimizer.repository.PerformanceRecordRepository;
import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@Log4j2
@AllArgsConstructor
public class JpaPerformanceStore implements PerformanceStore {

    private PerformanceRecordRepository performanceRecordRepository;

    @Override
    @Transactional
    public PerformanceRecord upsertPerformance(String accountId, LocalDate weekStart, String campaign, String adGroup,
                                               String target, String matchType, PerformanceMetrics metrics) {
        return upsert(accountId, weekStart, campaign, adGroup, target, "", matchType, metrics);
    }

    @Override
    @Transactional
    public PerformanceRecord upsertPerformance(String accountId, PerformanceUpsert row) {
        return upsert(accountId, row.weekStart(), row.campaignName(), row.adGroupName(), row.targetText(),
                row.searchTerm(), row.matchType(), row.metrics());
    }

    private PerformanceRecord upsert(String accountId, LocalDate weekStart, String campaign, String adGroup,
                                     String target, String searchTerm, String matchType, PerformanceMetrics metrics) {
        String campaignName = clean(campaign);
        String adGroupName = clean(adGroup);
        String targetText = clean(target);
        String term = clean(searchTerm);
        String match = clean(matchType);
        try {
            PerformanceRecord record = performanceRecordRepository
                    .findByAccountIdAndWeekStartAndCampaignNameAndAdGroupNameAndTargetTextAndSearchTermAndMatchType(
                            accountId, weekStart, campaignName, adGroupName, targetText, term, match)
                    .orElseGet(() -> PerformanceRecord.builder()
                            .accountId(accountId)
                            .weekStart(weekStart)
                            .campaignName(campaignName)
                            .adGroupName(adGroupName)
                            .targetText(targetText)
                            .searchTerm(term)
                            .matchType(match)
                            .build());

            record.setSpend(add(record.getSpend(), metrics.spend()));
            record.setSales(add(record.getSales(), metrics.sales()));
            record.setClicks(record.clickCount() + metrics.clicks());
            record.setImpressions(record.impressionCount() + metrics.impressions());
            record.setOrders(record.orderCount() + metrics.orders());
            if (metrics.reportDate() != null
                    && (record.getLastReportDate() == null || metrics.reportDate().isAfter(record.getLastReportDate()))) {
                record.setLastReportDate(metrics.reportDate());
            }
            record.markIngested(Instant.now());
            return performanceRecordRepository.save(record);
        } catch (DataAccessException e) {
            throw new PerformanceDataException("Failed to upsert performance for account " + accountId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<PerformanceRecord> queryPerformance(String accountId, DateRange range, PerformanceFilter filter) {
        PerformanceFilter effective = filter == null ? PerformanceFilter.none() : filter;
        try {
            List<PerformanceRecord> records = performanceRecordRepository
                    .findByAccountIdAndWeekStartBetweenOrderByIdAsc(accountId, range.start(), range.end())
                    .stream()
                    .filter(effective::matches)
                    .toList();
            log.debug("Loaded {} performance records for account {} in {}..{}",
                    records.size(), accountId, range.start(), range.end());
            return records;
        } catch (DataAccessException e) {
            throw new PerformanceDataException("Failed to query performance for account " + accountId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LocalDate> latestRawDate(String accountId) {
        try {
            return performanceRecordRepository.findLatestRawDate(accountId);
        } catch (DataAccessException e) {
            throw new PerformanceDataException("Failed to resolve latest raw date for account " + accountId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<LocalDate> bucketStarts(String accountId) {
        try {
            return performanceRecordRepository.findDistinctWeekStarts(accountId);
        } catch (DataAccessException e) {
            throw new PerformanceDataException("Failed to list buckets for account " + accountId, e);
        }
    }

    private static BigDecimal add(BigDecimal current, BigDecimal delta) {
        BigDecimal base = current == null ? BigDecimal.ZERO : current;
        return delta == null ? base : base.add(delta);
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }
}
