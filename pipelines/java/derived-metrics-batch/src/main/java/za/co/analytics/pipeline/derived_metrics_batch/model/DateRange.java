package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * A closed interval of business dates.
 */
public record DateRange(
        LocalDate start,
        LocalDate end
) {

    public DateRange {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after its end " + end);
        }
    }

    public static DateRange trailing(LocalDate end, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Days back must be at least 1, got " + days);
        }
        return new DateRange(end.minusDays(days - 1L), end);
    }

    /**
     * Resolves the logbook range selectors. {@code daysBack} and {@code since} are
     * mutually exclusive; {@code until} defaults to today. With neither selector the
     * range is the trailing {@code defaultDaysBack} days ending today.
     */
    public static DateRange resolve(@Nullable Integer daysBack,
                                    @Nullable LocalDate since,
                                    @Nullable LocalDate until,
                                    LocalDate today,
                                    int defaultDaysBack) {
        if (daysBack != null && since != null) {
            throw new IllegalArgumentException("--days-back and --since cannot be combined");
        }
        LocalDate end = until != null ? until : today;
        if (daysBack != null) {
            return trailing(end, daysBack);
        }
        if (since != null) {
            return new DateRange(since, end);
        }
        return trailing(today, defaultDaysBack);
    }

    @Override
    public String toString() {
        return start + " .. " + end;
    }
}
