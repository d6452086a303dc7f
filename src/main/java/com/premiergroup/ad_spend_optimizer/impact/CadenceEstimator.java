package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.optimizer.Statistics;
import lombok.extern.log4j.Log4j2;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Sizes comparison windows from the gap between consecutive performance buckets.
 */
@Log4j2
public final class CadenceEstimator {

    private CadenceEstimator() {
    }

    public static WindowSizing estimate(List<LocalDate> bucketStarts, ImpactConfig config) {
        List<LocalDate> distinct = new ArrayList<>(new TreeSet<>(bucketStarts));
        double[] gaps = new double[Math.max(0, distinct.size() - 1)];
        for (int i = 1; i < distinct.size(); i++) {
            gaps[i - 1] = DAYS.between(distinct.get(i - 1), distinct.get(i));
        }

        if (gaps.length < 2) {
            log.info("Cadence: {} buckets, too few to measure; using {}-day fallback window",
                    distinct.size(), config.getFallbackWindowDays());
            return fallback(config, 0.0);
        }

        double median = Statistics.median(gaps);
        double[] deviations = new double[gaps.length];
        for (int i = 0; i < gaps.length; i++) {
            deviations[i] = Math.abs(gaps[i] - median);
        }
        double spread = Statistics.median(deviations);
        if (median <= 0 || spread / median > config.getCadenceTolerance()) {
            log.info("Cadence: unstable (median gap {} days, spread {}); using {}-day fallback window",
                    median, spread, config.getFallbackWindowDays());
            return fallback(config, median);
        }

        int days = (int) Math.round(median) * config.getWindowPeriods();
        return new WindowSizing(days, days, median, false);
    }

    private static WindowSizing fallback(ImpactConfig config, double median) {
        return new WindowSizing(config.getFallbackWindowDays(), config.getFallbackWindowDays(), median, true);
    }
}
