package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.jspecify.annotations.Nullable;

/**
 * Which keys a usage recompute covers: everything, or one (pharmacy, product code) pair.
 */
public record UsageScope(
        @Nullable Integer pharmacyId,
        @Nullable String productCode
) {

    private static final UsageScope ALL = new UsageScope(null, null);

    public UsageScope {
        if ((pharmacyId == null) != (productCode == null)) {
            throw new IllegalArgumentException("A single-key scope needs both a pharmacy id and a product code");
        }
        if (productCode != null && productCode.isBlank()) {
            throw new IllegalArgumentException("Product code must not be blank");
        }
    }

    public static UsageScope all() {
        return ALL;
    }

    public static UsageScope product(int pharmacyId, String productCode) {
        return new UsageScope(pharmacyId, productCode);
    }

    public boolean isAll() {
        return productCode == null;
    }

    @Override
    public String toString() {
        return isAll() ? "ALL" : "pharmacy " + pharmacyId + " / product " + productCode;
    }
}
