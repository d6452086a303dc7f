package com.premiergroup.ad_spend_optimizer.dto;

import java.time.LocalDate;

import static java.time.temporal.ChronoUnit.DAYS;

public record DateRange(
        LocalDate start,
        LocalDate end
) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range requires both start and end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Date range end " + end + " is before start " + start);
        }
    }

    public static DateRange endingAt(LocalDate end, int days) {
        return new DateRange(end.minusDays(days - 1L), end);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public long days() {
        return DAYS.between(start, end) + 1;
    }
}
