package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public record CoverageRow(
        LocalDate businessDate,
        Integer pharmacyId,
        String pharmacyName,
        Set<ReportKind> received
) {

    public CoverageRow {
        received = received.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ReportKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(received));
    }

    public boolean hasReceived(ReportKind kind) {
        return received.contains(kind);
    }

    /** Kinds not yet received for this day, in {@link ReportKind} declaration order. */
    public List<ReportKind> missing() {
        return Arrays.stream(ReportKind.values())
                .filter(kind -> !received.contains(kind))
                .collect(Collectors.toUnmodifiableList());
    }

    public boolean isComplete() {
        return received.size() == ReportKind.values().length;
    }
}
