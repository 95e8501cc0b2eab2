package za.co.analytics.pipeline.derived_metrics_batch.repository;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class ProductRepository {

    private static final String SQL_FIND_ID_BY_CODE =
            "SELECT product_id FROM pharma.products WHERE product_code = ?";

    private final JdbcTemplate jdbcTemplate;

    public ProductRepository(@Qualifier("appJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Long> findIdByCode(String productCode) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(SQL_FIND_ID_BY_CODE, Long.class, productCode));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }
}
