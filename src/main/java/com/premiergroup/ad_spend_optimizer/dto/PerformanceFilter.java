package com.premiergroup.ad_spend_optimizer.dto;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;

import java.util.Set;

/**
 * Optional narrowing of a performance query. Empty sets match everything.
 */
public record PerformanceFilter(
        Set<String> campaigns,
        Set<String> matchTypes
) {

    public static PerformanceFilter none() {
        return new PerformanceFilter(Set.of(), Set.of());
    }

    public boolean matches(PerformanceRecord record) {
        return matchesAny(campaigns, record.getCampaignName()) && matchesAny(matchTypes, record.getMatchType());
    }

    private static boolean matchesAny(Set<String> allowed, String value) {
        if (allowed == null || allowed.isEmpty()) {
            return true;
        }
        return value != null && allowed.stream().anyMatch(value::equalsIgnoreCase);
    }
}
