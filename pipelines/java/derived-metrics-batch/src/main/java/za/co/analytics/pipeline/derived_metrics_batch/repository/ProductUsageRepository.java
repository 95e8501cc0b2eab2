package za.co.analytics.pipeline.derived_metrics_batch.repository;

import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsageView;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageKey;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindows;
import za.co.analytics.pipeline.derived_metrics_batch.reader.ProductUsageRowMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side of {@code pharma.product_usage}. Writes go through the batch writer only.
 */
@Repository
public class ProductUsageRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final UsageWindows usageWindows;
    private final ProductUsageRowMapper usageRowMapper;
    private final String usageColumns;

    public ProductUsageRepository(@Qualifier("appNamedParameterJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
                                  UsageWindows usageWindows) {
        this.jdbcTemplate = jdbcTemplate;
        this.usageWindows = usageWindows;
        this.usageRowMapper = new ProductUsageRowMapper(usageWindows);
        this.usageColumns = usageWindows.windows().stream()
                .map(window -> "u." + window.columnName())
                .collect(Collectors.joining(", ", "u.pharmacy_id, u.product_id, ", ", u.last_recalc"));
    }

    public long countAll() {
        Long count = jdbcTemplate.getJdbcTemplate()
                .queryForObject("SELECT COUNT(*) FROM pharma.product_usage", Long.class);
        return count != null ? count : 0L;
    }

    public Optional<ProductUsage> findByKey(UsageKey key) {
        String sql = "SELECT " + usageColumns + " FROM pharma.product_usage u " +
                "WHERE u.pharmacy_id = :pharmacyId AND u.product_id = :productId";
        List<ProductUsage> rows = jdbcTemplate.query(sql, keyParameters(key), usageRowMapper);
        return rows.stream().findFirst();
    }

    public Optional<ProductUsageView> findByProductCode(int pharmacyId, String productCode) {
        String sql = "SELECT p.product_code, p.description, " + usageColumns + " " +
                "FROM pharma.product_usage u " +
                "JOIN pharma.products p ON p.product_id = u.product_id " +
                "WHERE u.pharmacy_id = :pharmacyId AND p.product_code = :productCode";
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("pharmacyId", pharmacyId)
                .addValue("productCode", productCode);
        return jdbcTemplate.query(sql, parameters, viewRowMapper()).stream().findFirst();
    }

    /**
     * Products of one pharmacy ranked by their lookback-window average, highest first.
     */
    public List<ProductUsageView> findTopByLookbackAverage(int pharmacyId, int limit) {
        String rankColumn = "u." + usageWindows.lookback().columnName();
        String sql = "SELECT p.product_code, p.description, " + usageColumns + " " +
                "FROM pharma.product_usage u " +
                "JOIN pharma.products p ON p.product_id = u.product_id " +
                "WHERE u.pharmacy_id = :pharmacyId AND " + rankColumn + " IS NOT NULL " +
                "ORDER BY " + rankColumn + " DESC, p.product_code " +
                "LIMIT :limit";
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("pharmacyId", pharmacyId)
                .addValue("limit", limit);
        return jdbcTemplate.query(sql, parameters, viewRowMapper());
    }

    private RowMapper<ProductUsageView> viewRowMapper() {
        return (resultSet, rowNum) -> new ProductUsageView(
                resultSet.getString("product_code"),
                resultSet.getString("description"),
                usageRowMapper.mapRow(resultSet, rowNum)
        );
    }

    private static MapSqlParameterSource keyParameters(UsageKey key) {
        return new MapSqlParameterSource()
                .addValue("pharmacyId", key.pharmacyId())
                .addValue("productId", key.productId());
    }
}
