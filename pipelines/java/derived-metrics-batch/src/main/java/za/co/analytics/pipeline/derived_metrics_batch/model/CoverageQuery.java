package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.jspecify.annotations.Nullable;

/**
 * Filters for a logbook lookup. Results are ordered by business date
 * (descending unless {@code ascending}), then by pharmacy id.
 */
public record CoverageQuery(
        DateRange range,
        @Nullable Integer pharmacyId,
        @Nullable String pharmacyNameLike,
        boolean missingOnly,
        boolean ascending
) {

    public static CoverageQuery of(DateRange range) {
        return new CoverageQuery(range, null, null, false, false);
    }

    public CoverageQuery withPharmacyId(@Nullable Integer id) {
        return new CoverageQuery(range, id, pharmacyNameLike, missingOnly, ascending);
    }

    public CoverageQuery withPharmacyNameLike(@Nullable String fragment) {
        return new CoverageQuery(range, pharmacyId, fragment, missingOnly, ascending);
    }

    public CoverageQuery withMissingOnly(boolean onlyMissing) {
        return new CoverageQuery(range, pharmacyId, pharmacyNameLike, onlyMissing, ascending);
    }

    public CoverageQuery withAscending(boolean oldestFirst) {
        return new CoverageQuery(range, pharmacyId, pharmacyNameLike, missingOnly, oldestFirst);
    }
}
