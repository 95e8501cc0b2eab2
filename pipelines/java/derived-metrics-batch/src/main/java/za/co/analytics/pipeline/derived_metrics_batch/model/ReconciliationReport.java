package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

public record ReconciliationReport(
        List<ImportBatch> problematicBatches,
        @Nullable ImportBatch lastSuccessfulBatch
) {

    public ReconciliationReport {
        problematicBatches = List.copyOf(problematicBatches);
    }

    public boolean hasProblematicBatches() {
        return !problematicBatches.isEmpty();
    }

    /** False when no batch in the store has a single linked row. */
    public boolean hasSuccessfulBatch() {
        return lastSuccessfulBatch != null;
    }

    public Optional<ImportBatch> lastSuccessful() {
        return Optional.ofNullable(lastSuccessfulBatch);
    }
}
