package com.premiergroup.ad_spend_optimizer.optimizer;

import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Fuzzy lookup against keywords that already run as exact match.
 */
public class ExactKeywordMatcher {

    private final Set<String> keywords = new LinkedHashSet<>();
    private final double threshold;

    public ExactKeywordMatcher(Collection<String> exactKeywords, double threshold) {
        this.threshold = threshold;
        for (String keyword : exactKeywords) {
            String normalized = TargetingText.stripTargetingPrefix(keyword);
            if (!normalized.isEmpty()) {
                keywords.add(normalized);
            }
        }
    }

    /**
     * 1 - Levenshtein distance / longer length, so identical strings score 1.0.
     */
    public static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) StringUtils.getLevenshteinDistance(a, b) / longest;
    }

    public Optional<String> findMatch(String term) {
        String normalized = TargetingText.stripTargetingPrefix(term);
        if (keywords.contains(normalized)) {
            return Optional.of(normalized);
        }
        return keywords.stream()
                .filter(keyword -> similarity(keyword, normalized) >= threshold)
                .findFirst();
    }

    public int size() {
        return keywords.size();
    }
}
