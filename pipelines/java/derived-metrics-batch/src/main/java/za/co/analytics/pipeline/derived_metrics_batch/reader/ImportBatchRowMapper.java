package za.co.analytics.pipeline.derived_metrics_batch.reader;

import za.co.analytics.pipeline.derived_metrics_batch.model.ImportBatch;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;

public class ImportBatchRowMapper implements RowMapper<ImportBatch> {

    @Override
    public ImportBatch mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new ImportBatch(
                resultSet.getLong("batch_id"),
                resultSet.getInt("pharmacy_id"),
                resultSet.getString("pharmacy_name"),
                resultSet.getString("source_filename"),
                resultSet.getObject("uploaded_at", OffsetDateTime.class),
                resultSet.getInt("claimed_record_count"),
                resultSet.getLong("derived_record_count"),
                resultSet.getString("status"),
                resultSet.getString("error_message")
        );
    }
}
