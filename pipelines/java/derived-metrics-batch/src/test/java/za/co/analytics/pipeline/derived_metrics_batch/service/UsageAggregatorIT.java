package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.exception.DataUnavailableException;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageKey;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ProductUsageRepository;
import za.co.analytics.pipeline.derived_metrics_batch.runner.DerivedMetricsCommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the usage refresh job end to end: Spring context, job repository, step-scoped
 * reader and processor, upsert writer and summary count step.
 */
@SpringBootTest
@Testcontainers
@DisplayName("UsageAggregator Integration Tests")
class UsageAggregatorIT {

    private static final UsageKey PARACETAMOL = new UsageKey(1, 501L);
    private static final UsageKey IBUPROFEN = new UsageKey(1, 502L);
    private static final UsageKey DORMANT = new UsageKey(2, 503L);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("pharma_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.app.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.app.username", postgres::getUsername);
        registry.add("spring.datasource.app.password", postgres::getPassword);
    }

    @MockitoBean
    private DerivedMetricsCommandRunner commandRunner;

    @Autowired
    private UsageAggregator usageAggregator;

    @Autowired
    private ProductUsageRepository productUsageRepository;

    @Autowired
    @Qualifier("appDataSource")
    private DataSource appDataSource;

    private JdbcTemplate jdbcTemplate;
    private LocalDate today;

    @BeforeEach
    void setUp() {
        new ResourceDatabasePopulator(new ClassPathResource("schema-test.sql")).execute(appDataSource);
        jdbcTemplate = new JdbcTemplate(appDataSource);
        jdbcTemplate.execute("TRUNCATE pharma.debtors, pharma.debtor_reports, pharma.report_coverage, " +
                "pharma.product_usage, pharma.fact_stock_activity, pharma.products, pharma.pharmacies " +
                "RESTART IDENTITY CASCADE");
        jdbcTemplate.update("INSERT INTO pharma.pharmacies (pharmacy_id, name) VALUES (1, 'Reitz Apteek'), (2, 'Bethlehem Pharmacy')");
        jdbcTemplate.update("INSERT INTO pharma.products (product_id, product_code, description) VALUES " +
                "(501, 'LP9103984', 'Paracetamol 500mg'), (502, 'LP2000001', 'Ibuprofen 200mg'), (503, 'LP3000001', NULL)");

        today = LocalDate.now();
        insertSale(1, 501L, today.minusDays(5), "10");
        insertSale(1, 501L, today.minusDays(40), "100");
        insertSale(1, 502L, today.minusDays(120), "18");
        insertSale(2, 503L, today.minusDays(400), "9");
        insertSale(2, 503L, today.minusDays(3), "0");
    }

    // ==================== refreshAll ====================

    @Test
    @DisplayName("refreshAll - count matches the stored rows and keys without qualifying sales get none")
    void refreshAll_WritesActiveKeysOnly() {
        // When
        long summaryRows = usageAggregator.refreshAll();

        // Then
        assertThat(summaryRows).isEqualTo(2);
        assertThat(summaryRows).isEqualTo(productUsageRepository.countAll());
        assertThat(productUsageRepository.findByKey(DORMANT)).isEmpty();

        ProductUsage paracetamol = productUsageRepository.findByKey(PARACETAMOL).orElseThrow();
        assertThat(paracetamol.averageFor(30)).isEqualByComparingTo("0.333");
        assertThat(paracetamol.averageFor(90)).isEqualByComparingTo("1.222");
        assertThat(paracetamol.averageFor(180)).isEqualByComparingTo("0.611");

        ProductUsage ibuprofen = productUsageRepository.findByKey(IBUPROFEN).orElseThrow();
        assertThat(ibuprofen.averageFor(30)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(ibuprofen.averageFor(180)).isEqualByComparingTo("0.100");
    }

    @Test
    @DisplayName("refreshAll - second run in the same process keeps the averages and advances last_recalc")
    void refreshAll_TwiceIsStable() {
        // Given
        usageAggregator.refreshAll();
        ProductUsage first = productUsageRepository.findByKey(PARACETAMOL).orElseThrow();

        // When
        long summaryRows = usageAggregator.refreshAll();

        // Then
        ProductUsage second = productUsageRepository.findByKey(PARACETAMOL).orElseThrow();
        assertThat(summaryRows).isEqualTo(2);
        assertThat(second.averages()).isEqualTo(first.averages());
        assertThat(second.lastRecalc()).isAfter(first.lastRecalc());
    }

    // ==================== refreshProduct ====================

    @Test
    @DisplayName("refreshProduct - several products in a row each get their own run")
    void refreshProduct_ConsecutiveProducts() {
        // When
        Optional<ProductUsage> paracetamol = usageAggregator.refreshProduct(1, "LP9103984");
        Optional<ProductUsage> ibuprofen = usageAggregator.refreshProduct(1, "LP2000001");
        Optional<ProductUsage> noSales = usageAggregator.refreshProduct(1, "LP3000001");

        // Then
        assertThat(paracetamol).hasValueSatisfying(usage ->
                assertThat(usage.averageFor(90)).isEqualByComparingTo("1.222"));
        assertThat(ibuprofen).hasValueSatisfying(usage ->
                assertThat(usage.averageFor(180)).isEqualByComparingTo("0.100"));
        assertThat(noSales).isEmpty();
        assertThat(productUsageRepository.countAll()).isEqualTo(2);
    }

    @Test
    @DisplayName("refreshProduct - same averages as the full refresh")
    void refreshProduct_MatchesFullRefresh() {
        // Given
        usageAggregator.refreshAll();
        ProductUsage fromFull = productUsageRepository.findByKey(PARACETAMOL).orElseThrow();

        // When
        ProductUsage fromSingle = usageAggregator.refreshProduct(1, "LP9103984").orElseThrow();

        // Then
        assertThat(fromSingle.averages()).isEqualTo(fromFull.averages());
        assertThat(fromSingle.lastRecalc()).isAfter(fromFull.lastRecalc());
    }

    @Test
    @DisplayName("refreshProduct - unknown product code is unavailable data and writes nothing")
    void refreshProduct_UnknownCode() {
        assertThatThrownBy(() -> usageAggregator.refreshProduct(1, "NOPE"))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessage("Product NOPE not found");
        assertThat(productUsageRepository.countAll()).isZero();
    }

    private void insertSale(int pharmacyId, long productId, LocalDate date, String qty) {
        jdbcTemplate.update("INSERT INTO pharma.fact_stock_activity (pharmacy_id, business_date, product_id, qty_sold) " +
                "VALUES (?, ?, ?, ?)", pharmacyId, date, productId, new BigDecimal(qty));
    }
}
