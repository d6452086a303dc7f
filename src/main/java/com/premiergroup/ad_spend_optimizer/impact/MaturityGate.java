package com.premiergroup.ad_spend_optimizer.impact;

import java.time.LocalDate;

/**
 * A decision is measurable once its horizon and the reporting buffer have fully elapsed
 * before the latest raw report date.
 */
public final class MaturityGate {

    private MaturityGate() {
    }

    public static boolean isMature(LocalDate decisionDate, int horizonDays, int bufferDays, LocalDate latestRawDate) {
        if (decisionDate == null || latestRawDate == null) {
            return false;
        }
        return !decisionDate.plusDays((long) horizonDays + bufferDays).isAfter(latestRawDate);
    }
}
