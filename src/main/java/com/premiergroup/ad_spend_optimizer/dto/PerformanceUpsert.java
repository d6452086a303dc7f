package com.premiergroup.ad_spend_optimizer.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One canonical weekly row as delivered by the ingestion layer.
 */
public record PerformanceUpsert(
        @NotNull LocalDate weekStart,
        @NotBlank String campaignName,
        @NotNull String adGroupName,
        @NotBlank String targetText,
        String searchTerm,
        @NotBlank String matchType,
        @NotNull @PositiveOrZero BigDecimal spend,
        @NotNull @PositiveOrZero BigDecimal sales,
        @PositiveOrZero int clicks,
        @PositiveOrZero int impressions,
        @PositiveOrZero int orders,
        LocalDate reportDate
) {

    public PerformanceMetrics metrics() {
        return new PerformanceMetrics(spend, sales, clicks, impressions, orders, reportDate);
    }
}
