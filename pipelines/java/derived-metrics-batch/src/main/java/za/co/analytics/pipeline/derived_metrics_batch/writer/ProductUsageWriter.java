package za.co.analytics.pipeline.derived_metrics_batch.writer;

import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindow;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import javax.sql.DataSource;
import java.util.stream.Collectors;

/**
 * Merges usage summaries into {@code pharma.product_usage}, one atomic
 * insert-or-update per (pharmacy, product). Concurrent runs on the same key end
 * with the last writer's values, never a duplicate row.
 */
public class ProductUsageWriter implements ItemWriter<ProductUsage> {

    private static final Logger log = LoggerFactory.getLogger(ProductUsageWriter.class);

    private final UsageWindows usageWindows;
    private final JdbcBatchItemWriter<ProductUsage> delegateWriter;

    public ProductUsageWriter(DataSource dataSource, UsageWindows usageWindows) {
        this.usageWindows = usageWindows;
        this.delegateWriter = createDelegateWriter(dataSource);
    }

    private JdbcBatchItemWriter<ProductUsage> createDelegateWriter(DataSource dataSource) {
        JdbcBatchItemWriter<ProductUsage> writer = new JdbcBatchItemWriterBuilder<ProductUsage>()
                .itemSqlParameterSourceProvider(this::toParameters)
                .sql(upsertSql())
                .dataSource(dataSource)
                .build();
        // the builder does not run the named parameter detection
        try {
            writer.afterPropertiesSet();
        } catch (Exception e) {
            throw new IllegalStateException("Invalid product usage upsert writer", e);
        }
        return writer;
    }

    /**
     * The recalculation timestamp never moves backwards, and advances by at least a
     * microsecond on every merge of an existing key.
     */
    String upsertSql() {
        String averageColumns = usageWindows.windows().stream()
                .map(UsageWindow::columnName)
                .collect(Collectors.joining(", "));
        String averageParameters = usageWindows.windows().stream()
                .map(window -> ":" + window.columnName())
                .collect(Collectors.joining(", "));
        String averageUpdates = usageWindows.windows().stream()
                .map(window -> window.columnName() + " = EXCLUDED." + window.columnName())
                .collect(Collectors.joining(", "));

        return "INSERT INTO pharma.product_usage AS u (pharmacy_id, product_id, " + averageColumns + ", last_recalc) " +
                "VALUES (:pharmacyId, :productId, " + averageParameters + ", :lastRecalc) " +
                "ON CONFLICT (pharmacy_id, product_id) DO UPDATE SET " +
                averageUpdates + ", " +
                "last_recalc = GREATEST(EXCLUDED.last_recalc, u.last_recalc + INTERVAL '1 microsecond')";
    }

    SqlParameterSource toParameters(ProductUsage usage) {
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("pharmacyId", usage.pharmacyId())
                .addValue("productId", usage.productId())
                .addValue("lastRecalc", usage.lastRecalc());
        for (UsageWindow window : usageWindows.windows()) {
            parameters.addValue(window.columnName(), usage.averageFor(window));
        }
        return parameters;
    }

    @Override
    public void write(Chunk<? extends ProductUsage> chunk) throws Exception {
        if (chunk.isEmpty()) {
            log.debug("No usage summaries in this chunk");
            return;
        }
        delegateWriter.write(chunk);
        log.debug("Merged {} usage summaries", chunk.size());
    }
}
