package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The configured set of trailing windows plus the rounding scale of their averages.
 * The lookback window is the widest of them.
 */
public record UsageWindows(
        List<UsageWindow> windows,
        int scale
) {

    public UsageWindows {
        if (windows == null || windows.isEmpty()) {
            throw new IllegalArgumentException("At least one usage window is required");
        }
        if (scale < 0) {
            throw new IllegalArgumentException("Scale must not be negative, got " + scale);
        }
        windows = windows.stream().distinct().sorted().collect(Collectors.toUnmodifiableList());
    }

    public static UsageWindows ofDays(List<Integer> days, int scale) {
        return new UsageWindows(days.stream().map(UsageWindow::new).collect(Collectors.toList()), scale);
    }

    public UsageWindow lookback() {
        return windows.get(windows.size() - 1);
    }

    public LocalDate lookbackStart(LocalDate processingDate) {
        return lookback().startDate(processingDate);
    }
}
