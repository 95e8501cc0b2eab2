package za.co.analytics.pipeline.derived_metrics_batch.reader;

import za.co.analytics.pipeline.derived_metrics_batch.model.FactActivity;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

public class FactActivityRowMapper implements RowMapper<FactActivity> {

    @Override
    public FactActivity mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new FactActivity(
                resultSet.getInt("pharmacyId"),
                resultSet.getLong("productId"),
                resultSet.getObject("businessDate", LocalDate.class),
                resultSet.getBigDecimal("qtySold")
        );
    }
}
