package za.co.analytics.pipeline.derived_metrics_batch.reader;

import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageRow;
import za.co.analytics.pipeline.derived_metrics_batch.model.ReportKind;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

public class CoverageRowMapper implements RowMapper<CoverageRow> {

    @Override
    public CoverageRow mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        Set<ReportKind> received = EnumSet.noneOf(ReportKind.class);
        for (ReportKind kind : ReportKind.values()) {
            if (resultSet.getBoolean(kind.columnName())) {
                received.add(kind);
            }
        }
        return new CoverageRow(
                resultSet.getObject("business_date", LocalDate.class),
                resultSet.getInt("pharmacy_id"),
                resultSet.getString("pharmacy_name"),
                received
        );
    }
}
