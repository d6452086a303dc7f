package com.premiergroup.ad_spend_optimizer.repository;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PerformanceRecordRepository extends JpaRepository<PerformanceRecord, Long> {

    Optional<PerformanceRecord> findByAccountIdAndWeekStartAndCampaignNameAndAdGroupNameAndTargetTextAndSearchTermAndMatchType(
            String accountId,
            LocalDate weekStart,
            String campaignName,
            String adGroupName,
            String targetText,
            String searchTerm,
            String matchType
    );

    List<PerformanceRecord> findByAccountIdAndWeekStartBetweenOrderByIdAsc(
            String accountId,
            LocalDate start,
            LocalDate end
    );

    @Query("select max(coalesce(p.lastReportDate, p.ingestedThrough, p.weekStart)) from PerformanceRecord p where p.accountId = :accountId")
    Optional<LocalDate> findLatestRawDate(@Param("accountId") String accountId);

    @Query("select distinct p.weekStart from PerformanceRecord p where p.accountId = :accountId order by p.weekStart")
    List<LocalDate> findDistinctWeekStarts(@Param("accountId") String accountId);
}
