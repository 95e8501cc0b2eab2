package za.co.analytics.pipeline.derived_metrics_batch.repository;

import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageQuery;
import za.co.analytics.pipeline.derived_metrics_batch.model.CoverageRow;
import za.co.analytics.pipeline.derived_metrics_batch.model.ReportKind;
import za.co.analytics.pipeline.derived_metrics_batch.reader.CoverageRowMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Queries {@code pharma.report_coverage}. Days on which no report kind was received
 * are never returned.
 */
@Repository
public class ReportCoverageRepository {

    private static final String KIND_COLUMNS = Arrays.stream(ReportKind.values())
            .map(kind -> "rc." + kind.columnName())
            .collect(Collectors.joining(", "));

    private static final String ANY_RECEIVED = Arrays.stream(ReportKind.values())
            .map(kind -> "rc." + kind.columnName())
            .collect(Collectors.joining(" OR ", "(", ")"));

    private static final String ALL_RECEIVED = Arrays.stream(ReportKind.values())
            .map(kind -> "rc." + kind.columnName())
            .collect(Collectors.joining(" AND ", "(", ")"));

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final CoverageRowMapper rowMapper = new CoverageRowMapper();

    public ReportCoverageRepository(@Qualifier("appNamedParameterJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<CoverageRow> find(CoverageQuery query) {
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        String sql = buildSql(query, parameters);
        return jdbcTemplate.query(sql, parameters, rowMapper);
    }

    String buildSql(CoverageQuery query, MapSqlParameterSource parameters) {
        List<String> where = new ArrayList<>();
        where.add("rc.business_date BETWEEN :start AND :end");
        where.add(ANY_RECEIVED);
        parameters.addValue("start", query.range().start());
        parameters.addValue("end", query.range().end());

        if (query.pharmacyId() != null) {
            where.add("rc.pharmacy_id = :pharmacyId");
            parameters.addValue("pharmacyId", query.pharmacyId());
        }
        if (StringUtils.hasText(query.pharmacyNameLike())) {
            where.add("p.name ILIKE :pharmacyPattern");
            parameters.addValue("pharmacyPattern", "%" + escapeLike(query.pharmacyNameLike()) + "%");
        }
        if (query.missingOnly()) {
            where.add("NOT " + ALL_RECEIVED);
        }

        String order = query.ascending() ? "ASC" : "DESC";
        return "SELECT rc.business_date, rc.pharmacy_id, p.name AS pharmacy_name, " + KIND_COLUMNS + " " +
                "FROM pharma.report_coverage rc " +
                "JOIN pharma.pharmacies p ON p.pharmacy_id = rc.pharmacy_id " +
                "WHERE " + String.join(" AND ", where) + " " +
                "ORDER BY rc.business_date " + order + ", rc.pharmacy_id";
    }

    static String escapeLike(String fragment) {
        return fragment.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
