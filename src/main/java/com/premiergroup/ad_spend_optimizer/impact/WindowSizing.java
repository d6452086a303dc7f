package com.premiergroup.ad_spend_optimizer.impact;

/**
 * @param windowDays    length of both comparison windows
 * @param medianGapDays observed reporting cadence, 0 when it could not be measured
 * @param fallback      true when the cadence was unstable and the default window was used
 */
public record WindowSizing(
        int beforeDays,
        int afterDays,
        double medianGapDays,
        boolean fallback
) {

    public static WindowSizing explicit(int beforeDays, int afterDays) {
        return new WindowSizing(beforeDays, afterDays, 0.0, false);
    }
}
