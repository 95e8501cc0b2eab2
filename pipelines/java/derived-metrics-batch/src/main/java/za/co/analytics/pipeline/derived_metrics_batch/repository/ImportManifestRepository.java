package za.co.analytics.pipeline.derived_metrics_batch.repository;

import za.co.analytics.pipeline.derived_metrics_batch.model.DebtorTotals;
import za.co.analytics.pipeline.derived_metrics_batch.model.ImportBatch;
import za.co.analytics.pipeline.derived_metrics_batch.model.PharmacyImportActivity;
import za.co.analytics.pipeline.derived_metrics_batch.reader.ImportBatchRowMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the debtor import manifest ({@code pharma.debtor_reports}) and the
 * debtor rows linked to each batch. The linked row count is always counted, never read
 * from the manifest.
 */
@Repository
public class ImportManifestRepository {

    private static final String SELECT_BATCH =
            "SELECT dr.id AS batch_id, dr.pharmacy_id, p.name AS pharmacy_name, " +
            "dr.filename AS source_filename, dr.uploaded_at, " +
            "COALESCE(dr.total_accounts, 0) AS claimed_record_count, " +
            "COUNT(d.id) AS derived_record_count, dr.status, dr.error_message " +
            "FROM pharma.debtor_reports dr " +
            "LEFT JOIN pharma.pharmacies p ON p.pharmacy_id = dr.pharmacy_id " +
            "LEFT JOIN pharma.debtors d ON d.report_id = dr.id ";

    private static final String GROUP_BY_BATCH =
            "GROUP BY dr.id, dr.pharmacy_id, p.name, dr.filename, dr.uploaded_at, " +
            "dr.total_accounts, dr.status, dr.error_message ";

    private static final String NEWEST_FIRST = "ORDER BY dr.uploaded_at DESC, dr.id DESC ";

    private static final String SQL_PROBLEMATIC =
            SELECT_BATCH +
            "WHERE COALESCE(dr.total_accounts, 0) > 0 " +
            GROUP_BY_BATCH +
            "HAVING COUNT(d.id) = 0 " +
            NEWEST_FIRST +
            "LIMIT ?";

    private static final String SQL_LAST_SUCCESSFUL =
            SELECT_BATCH +
            GROUP_BY_BATCH +
            "HAVING COUNT(d.id) > 0 " +
            NEWEST_FIRST +
            "LIMIT 1";

    private static final String SQL_LATEST =
            SELECT_BATCH +
            GROUP_BY_BATCH +
            NEWEST_FIRST +
            "LIMIT 1";

    private static final String SQL_ACTIVITY_BY_PHARMACY =
            "SELECT dr.pharmacy_id, p.name AS pharmacy_name, COUNT(*) AS batch_count, " +
            "MAX(dr.uploaded_at) AS last_uploaded_at " +
            "FROM pharma.debtor_reports dr " +
            "JOIN pharma.pharmacies p ON p.pharmacy_id = dr.pharmacy_id " +
            "GROUP BY dr.pharmacy_id, p.name " +
            "ORDER BY last_uploaded_at DESC, dr.pharmacy_id";

    private static final String SQL_DEBTOR_TOTALS =
            "SELECT COUNT(DISTINCT pharmacy_id) AS pharmacy_count, COUNT(*) AS account_count, " +
            "COALESCE(SUM(balance), 0) AS total_outstanding " +
            "FROM pharma.debtors";

    private final JdbcTemplate jdbcTemplate;
    private final ImportBatchRowMapper rowMapper = new ImportBatchRowMapper();

    public ImportManifestRepository(@Qualifier("appJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Batches claiming records while having none linked, newest first.
     */
    public List<ImportBatch> findProblematic(int limit) {
        return jdbcTemplate.query(SQL_PROBLEMATIC, rowMapper, limit);
    }

    public Optional<ImportBatch> findLastSuccessful() {
        return jdbcTemplate.query(SQL_LAST_SUCCESSFUL, rowMapper).stream().findFirst();
    }

    public Optional<ImportBatch> findLatest() {
        return jdbcTemplate.query(SQL_LATEST, rowMapper).stream().findFirst();
    }

    public List<PharmacyImportActivity> findActivityByPharmacy() {
        return jdbcTemplate.query(SQL_ACTIVITY_BY_PHARMACY, (resultSet, rowNum) -> new PharmacyImportActivity(
                resultSet.getInt("pharmacy_id"),
                resultSet.getString("pharmacy_name"),
                resultSet.getLong("batch_count"),
                resultSet.getObject("last_uploaded_at", OffsetDateTime.class)
        ));
    }

    public DebtorTotals findDebtorTotals() {
        DebtorTotals totals = jdbcTemplate.queryForObject(SQL_DEBTOR_TOTALS, (resultSet, rowNum) -> new DebtorTotals(
                resultSet.getLong("pharmacy_count"),
                resultSet.getLong("account_count"),
                resultSet.getBigDecimal("total_outstanding")
        ));
        return totals != null ? totals : DebtorTotals.empty();
    }
}
