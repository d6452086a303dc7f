package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import org.apache.commons.lang3.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A target may be reported once at targeting level and again broken down by search term.
 * Both describe the same clicks, so only one level per (campaign, ad group, target, match type)
 * may be summed.
 */
public final class ReportingLevel {

    private ReportingLevel() {
    }

    /**
     * Targeting-level rows where a target has them, otherwise its search-term rows.
     */
    public static List<PerformanceRecord> targetView(List<PerformanceRecord> records) {
        Set<String> withTargetRows = keysWhere(records, true);
        return records.stream()
                .filter(r -> isTargetLevel(r) || !withTargetRows.contains(targetKey(r)))
                .toList();
    }

    /**
     * Search-term rows where a target has them, otherwise its targeting-level row standing in as the query.
     */
    public static List<PerformanceRecord> queryView(List<PerformanceRecord> records) {
        Set<String> withTermRows = keysWhere(records, false);
        return records.stream()
                .filter(r -> !isTargetLevel(r) || !withTermRows.contains(targetKey(r)))
                .toList();
    }

    static boolean isTargetLevel(PerformanceRecord row) {
        return StringUtils.isBlank(row.getSearchTerm());
    }

    private static Set<String> keysWhere(List<PerformanceRecord> records, boolean targetLevel) {
        Set<String> keys = new HashSet<>();
        for (PerformanceRecord row : records) {
            if (isTargetLevel(row) == targetLevel) {
                keys.add(targetKey(row));
            }
        }
        return keys;
    }

    private static String targetKey(PerformanceRecord row) {
        return TargetingText.normalize(row.getCampaignName()) + "|" + TargetingText.normalize(row.getAdGroupName())
                + "|" + TargetingText.normalize(row.getTargetText()) + "|" + TargetingText.normalize(row.getMatchType());
    }
}
