package com.premiergroup.ad_spend_optimizer.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PerformanceMetrics(
        BigDecimal spend,
        BigDecimal sales,
        int clicks,
        int impressions,
        int orders,
        LocalDate reportDate
) {}
