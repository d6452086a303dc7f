package com.premiergroup.ad_spend_optimizer.impact;

public record ImpactFilter(
        boolean matureOnly,
        boolean validatedOnly
) {

    public static ImpactFilter defaults() {
        return new ImpactFilter(true, true);
    }

    public static ImpactFilter all() {
        return new ImpactFilter(false, false);
    }

    public boolean accepts(ImpactRecord record) {
        return (!matureOnly || record.mature()) && (!validatedOnly || record.validated());
    }
}
