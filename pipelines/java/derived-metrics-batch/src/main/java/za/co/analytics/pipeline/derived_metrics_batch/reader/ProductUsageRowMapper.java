package za.co.analytics.pipeline.derived_metrics_batch.reader;

import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindow;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindows;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps {@code product_usage} rows; reads one average column per configured window.
 */
public class ProductUsageRowMapper implements RowMapper<ProductUsage> {

    private final UsageWindows usageWindows;

    public ProductUsageRowMapper(UsageWindows usageWindows) {
        this.usageWindows = usageWindows;
    }

    @Override
    public ProductUsage mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        Map<UsageWindow, BigDecimal> averages = new HashMap<>();
        for (UsageWindow window : usageWindows.windows()) {
            BigDecimal average = resultSet.getBigDecimal(window.columnName());
            averages.put(window, average != null ? average : BigDecimal.ZERO.setScale(usageWindows.scale()));
        }
        return new ProductUsage(
                resultSet.getInt("pharmacy_id"),
                resultSet.getLong("product_id"),
                averages,
                resultSet.getObject("last_recalc", OffsetDateTime.class)
        );
    }
}
