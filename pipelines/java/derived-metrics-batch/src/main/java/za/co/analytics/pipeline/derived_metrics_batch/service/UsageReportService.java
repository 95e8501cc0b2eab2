package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.exception.DataUnavailableException;
import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreOperationException;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsageView;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ProductUsageRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class UsageReportService {

    static final int MAX_LIMIT = 200;

    private final ProductUsageRepository productUsageRepository;

    public UsageReportService(ProductUsageRepository productUsageRepository) {
        this.productUsageRepository = productUsageRepository;
    }

    /**
     * Top products of a pharmacy by lookback-window average. {@code limit} must be in 1..200.
     */
    public List<ProductUsageView> topUsage(int pharmacyId, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        try {
            return productUsageRepository.findTopByLookbackAverage(pharmacyId, limit);
        } catch (DataAccessException e) {
            throw new StoreOperationException("Top usage lookup for pharmacy " + pharmacyId + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * @throws DataUnavailableException when the pharmacy has no summary for the product
     */
    public ProductUsageView usage(int pharmacyId, String productCode) {
        try {
            return productUsageRepository.findByProductCode(pharmacyId, productCode)
                    .orElseThrow(() -> new DataUnavailableException("Usage for product", productCode));
        } catch (DataAccessException e) {
            throw new StoreOperationException("Usage lookup for " + productCode + " failed: " + e.getMessage(), e);
        }
    }
}
