package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.config.DerivedMetricsProperties;
import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreOperationException;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportActivityReport;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportBatch;
import za.co.analytics.pipeline.derived_metrics_batch.model.ReconciliationReport;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ImportManifestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cross-checks the import manifest against the rows actually persisted for each
 * batch. Diagnostic only: nothing is repaired, retried or deleted.
 */
@Service
public class ReconciliationChecker {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationChecker.class);

    private final ImportManifestRepository importManifestRepository;
    private final DerivedMetricsProperties properties;

    public ReconciliationChecker(ImportManifestRepository importManifestRepository,
                                 DerivedMetricsProperties properties) {
        this.importManifestRepository = importManifestRepository;
        this.properties = properties;
    }

    public ReconciliationReport check() {
        return check(properties.reconciliation().problematicLimit());
    }

    /**
     * @param limit maximum number of problematic batches returned, newest first
     */
    public ReconciliationReport check(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1, got " + limit);
        }
        try {
            List<ImportBatch> problematic = importManifestRepository.findProblematic(limit);
            ImportBatch lastSuccessful = importManifestRepository.findLastSuccessful().orElse(null);

            for (ImportBatch batch : problematic) {
                log.warn("Import batch {} ({}) claims {} records but has none linked",
                        batch.batchId(), batch.sourceFilename(), batch.claimedRecordCount());
            }
            if (lastSuccessful == null) {
                log.warn("No import batch has any linked records");
            }
            return new ReconciliationReport(problematic, lastSuccessful);
        } catch (DataAccessException e) {
            throw new StoreOperationException("Import reconciliation failed: " + e.getMessage(), e);
        }
    }

    public ImportActivityReport importActivity() {
        try {
            return new ImportActivityReport(
                    importManifestRepository.findLatest().orElse(null),
                    importManifestRepository.findActivityByPharmacy(),
                    importManifestRepository.findDebtorTotals()
            );
        } catch (DataAccessException e) {
            throw new StoreOperationException("Import activity lookup failed: " + e.getMessage(), e);
        }
    }
}
