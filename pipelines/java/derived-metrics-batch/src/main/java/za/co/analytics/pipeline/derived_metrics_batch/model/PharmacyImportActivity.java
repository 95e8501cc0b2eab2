package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.time.OffsetDateTime;

public record PharmacyImportActivity(
        Integer pharmacyId,
        String pharmacyName,
        long batchCount,
        OffsetDateTime lastUploadedAt
) {
}
