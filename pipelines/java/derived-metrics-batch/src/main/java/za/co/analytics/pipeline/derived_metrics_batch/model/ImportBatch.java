package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;

/**
 * One import manifest entry. {@code derivedRecordCount} is counted from the rows
 * actually linked to the batch, never stored.
 */
public record ImportBatch(
        Long batchId,
        Integer pharmacyId,
        @Nullable String pharmacyName,
        String sourceFilename,
        OffsetDateTime uploadedAt,
        int claimedRecordCount,
        long derivedRecordCount,
        @Nullable String status,
        @Nullable String errorMessage
) {

    public boolean isProblematic() {
        return claimedRecordCount > 0 && derivedRecordCount == 0;
    }

    public boolean isSuccessful() {
        return derivedRecordCount > 0;
    }
}
