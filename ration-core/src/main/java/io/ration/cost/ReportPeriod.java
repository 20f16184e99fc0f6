package io.ration.cost;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

/** Reporting windows. Day and month are calendar periods in UTC; week is the trailing seven days. */
public enum ReportPeriod {
    DAY,
    WEEK,
    MONTH;

    public Instant start(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        switch (this) {
            case DAY: return today.atStartOfDay(ZoneOffset.UTC).toInstant();
            case WEEK: return now.minus(Duration.ofDays(7));
            default: return today.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
    }

    public static ReportPeriod parse(String s) {
        if (s == null) return MONTH;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MONTH;
        }
    }
}
