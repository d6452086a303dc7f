package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import lombok.extern.log4j.Log4j2;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static java.time.temporal.ChronoUnit.DAYS;

@Log4j2
public final class BenchmarkCalculator {

    private BenchmarkCalculator() {
    }

    public static AccountBenchmarks calculate(List<PerformanceRecord> records, OptimizerConfig config) {
        List<PerformanceRecord> targets = ReportingLevel.targetView(records);
        double[] substantial = targets.stream()
                .filter(r -> r.spendValue() > 0 && r.salesValue() > 0)
                .filter(r -> r.spendValue() >= config.getBaselineSpendFloor())
                .mapToDouble(r -> r.salesValue() / r.spendValue())
                .toArray();

        boolean fromTarget = substantial.length < config.getMinSubstantialRows();
        double universal = fromTarget
                ? config.getTargetRoas()
                : Statistics.winsorizedMedian(substantial, config.getWinsorPercentile());

        long clicks = targets.stream().mapToLong(PerformanceRecord::clickCount).sum();
        long orders = targets.stream().mapToLong(PerformanceRecord::orderCount).sum();
        double rawCvr = clicks > 0 ? (double) orders / clicks : config.getDefaultCvr();
        double cvr = Math.max(config.getMinCvr(), Math.min(config.getMaxCvr(), rawCvr));
        double expectedClicks = 1.0 / cvr;

        double soft = Math.max(config.getNegativeSoftClickFloor(), expectedClicks * config.getNegativeSoftThreshold());
        double hard = Math.max(config.getNegativeHardClickFloor(), expectedClicks * config.getNegativeHardThreshold());
        int harvestMinOrders = Math.max(config.getHarvestOrdersFloor(), (int) (config.getHarvestClickMin() * cvr));

        AccountBenchmarks benchmarks = new AccountBenchmarks(universal, fromTarget, substantial.length,
                rawCvr, cvr, expectedClicks, soft, hard, harvestMinOrders, dataDays(records));

        log.info("Benchmarks: universal ROAS {} ({} substantial rows{}), CVR {} (raw {}), soft {} / hard {} clicks, harvest min orders {}",
                String.format("%.2f", universal), substantial.length, fromTarget ? ", target fallback" : "",
                String.format("%.4f", cvr), String.format("%.4f", rawCvr),
                String.format("%.1f", soft), String.format("%.1f", hard), harvestMinOrders);
        return benchmarks;
    }

    /**
     * Days between the earliest bucket start and the latest raw report date, inclusive.
     */
    static long dataDays(List<PerformanceRecord> records) {
        LocalDate first = records.stream().map(PerformanceRecord::getWeekStart).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null);
        LocalDate last = records.stream().map(PerformanceRecord::reportDate).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);
        if (first == null || last == null || last.isBefore(first)) {
            return 0;
        }
        return DAYS.between(first, last) + 1;
    }
}
