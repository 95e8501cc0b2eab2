package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.time.LocalDate;

/**
 * A trailing window of {@code days} calendar days ending at the processing date, inclusive.
 */
public record UsageWindow(int days) implements Comparable<UsageWindow> {

    public UsageWindow {
        if (days < 1) {
            throw new IllegalArgumentException("Usage window must span at least one day, got " + days);
        }
    }

    public LocalDate startDate(LocalDate processingDate) {
        return processingDate.minusDays(days - 1L);
    }

    public boolean contains(LocalDate businessDate, LocalDate processingDate) {
        return !businessDate.isBefore(startDate(processingDate)) && !businessDate.isAfter(processingDate);
    }

    /** Summary store column holding this window's average, e.g. {@code avg_qty_30d}. */
    public String columnName() {
        return "avg_qty_" + days + "d";
    }

    @Override
    public int compareTo(UsageWindow other) {
        return Integer.compare(days, other.days);
    }
}
