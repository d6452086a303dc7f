package com.premiergroup.ad_spend_optimizer.optimizer;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalization rules for targeting expressions and search terms.
 */
public final class TargetingText {

    public static final Set<String> AUTO_TARGETING_TYPES =
            Set.of("close-match", "loose-match", "substitutes", "complements", "auto");

    private static final Pattern ASIN = Pattern.compile("^b0[a-z0-9]{8}$");
    private static final Pattern QUOTES = Pattern.compile("\"");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TargetingText() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
        return switch (normalized) {
            case "close match" -> "close-match";
            case "loose match" -> "loose-match";
            default -> normalized;
        };
    }

    /**
     * Removes {@code asin=} style prefixes and quoting, leaving the bare query or ASIN.
     */
    public static String stripTargetingPrefix(String text) {
        String normalized = normalize(text);
        for (String prefix : new String[]{"asin-expanded=", "asin="}) {
            if (normalized.startsWith(prefix)) {
                normalized = normalized.substring(prefix.length());
                break;
            }
        }
        return QUOTES.matcher(normalized).replaceAll("").trim();
    }

    public static boolean isAsin(String text) {
        return ASIN.matcher(stripTargetingPrefix(text)).matches();
    }

    public static boolean isProductTargeting(String normalizedTarget) {
        return normalizedTarget.contains("asin=") || normalizedTarget.contains("asin-expanded=")
                || ASIN.matcher(normalizedTarget).matches();
    }

    public static boolean isCategoryTargeting(String normalizedTarget) {
        return normalizedTarget.startsWith("category=")
                || (normalizedTarget.startsWith("category") && normalizedTarget.contains("="));
    }

    /**
     * True for targeting expressions that encode match metadata rather than a customer query.
     */
    public static boolean isTargetingExpression(String normalizedTerm) {
        return AUTO_TARGETING_TYPES.contains(normalizedTerm)
                || normalizedTerm.startsWith("category=")
                || normalizedTerm.startsWith("keyword-group=");
    }

    public static boolean isExactMatch(String matchType) {
        return StringUtils.containsIgnoreCase(matchType, "exact");
    }

    public static boolean isProductMatch(String matchType) {
        String match = normalize(matchType);
        return match.equals("pt") || match.contains("product");
    }

    /**
     * Search term when the row carries one, otherwise the targeting text.
     */
    public static String queryOf(String searchTerm, String targetText) {
        return StringUtils.isBlank(searchTerm) ? normalize(targetText) : normalize(searchTerm);
    }
}
