package io.ration.optimize;

import io.ration.core.QueueItem;
import io.ration.core.Urgency;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Suggests running low-urgency work after the 14:00-22:00 UTC peak when the off-peak window is under four hours
 * away. Off-peak runs are priced at a 10% discount.
 */
public class OffPeakOptimizer implements RequestOptimizer {
    static final int PEAK_START_HOUR = 14;
    static final int PEAK_END_HOUR = 22;
    static final Duration MAX_DEFERRAL = Duration.ofHours(4);
    static final double OFF_PEAK_DISCOUNT = 0.1;

    private final Clock clock;

    public OffPeakOptimizer(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public OptimizationResult optimize(QueueItem item) {
        if (item.urgency() != Urgency.LOW) return OptimizationResult.unchanged(item);
        Instant now = clock.instant();
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        int hour = utc.getHour();
        if (hour < PEAK_START_HOUR || hour >= PEAK_END_HOUR) return OptimizationResult.unchanged(item);

        Instant offPeak = utc.withHour(PEAK_END_HOUR).withMinute(0).withSecond(0).withNano(0).toInstant();
        if (Duration.between(now, offPeak).compareTo(MAX_DEFERRAL) >= 0) return OptimizationResult.unchanged(item);
        return new OptimizationResult(item, item, List.of("off_peak_defer"),
                item.estimatedCost() * OFF_PEAK_DISCOUNT, offPeak.toEpochMilli());
    }
}
