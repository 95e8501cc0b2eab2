package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

public record ImportActivityReport(
        @Nullable ImportBatch latestBatch,
        List<PharmacyImportActivity> byPharmacy,
        DebtorTotals totals
) {

    public ImportActivityReport {
        byPharmacy = List.copyOf(byPharmacy);
    }

    public Optional<ImportBatch> latest() {
        return Optional.ofNullable(latestBatch);
    }
}
