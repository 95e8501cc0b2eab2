package za.co.analytics.pipeline.derived_metrics_batch.config;

import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreConfigurationException;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.util.StringUtils;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    static final String URL_PROPERTY = "spring.datasource.app.url";
    static final String DEFAULT_DRIVER = "org.postgresql.Driver";
    static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    static final String DEFAULT_BATCH_URL = "jdbc:h2:mem:batch-metadata;DB_CLOSE_DELAY=-1";
    static final String DEFAULT_BATCH_DRIVER = "org.h2.Driver";
    static final String DEFAULT_BATCH_SCHEMA = "classpath:org/springframework/batch/core/schema-h2.sql";

    @Autowired
    private Environment env;

    @Autowired
    private DerivedMetricsProperties properties;

    @Bean(name = "appDataSource")
    public DataSource appDataSource() {
        String url = env.getProperty(URL_PROPERTY);
        if (!StringUtils.hasText(url)) {
            throw new StoreConfigurationException(URL_PROPERTY,
                    "No store connection configured: set DATABASE_URL or " + URL_PROPERTY);
        }
        if (!url.startsWith("jdbc:")) {
            throw new StoreConfigurationException(URL_PROPERTY,
                    "Store location must be a JDBC URL (jdbc:postgresql://host:port/db), got: " + url);
        }

        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("derived-metrics");
        dataSource.setDriverClassName(env.getProperty("spring.datasource.app.driver-class-name", DEFAULT_DRIVER));
        dataSource.setJdbcUrl(url);
        dataSource.setUsername(env.getProperty("spring.datasource.app.username"));
        dataSource.setPassword(env.getProperty("spring.datasource.app.password"));
        dataSource.setConnectionTimeout(
                env.getProperty("spring.datasource.app.connect-timeout-ms", Long.class, DEFAULT_CONNECT_TIMEOUT_MS));
        dataSource.setMaximumPoolSize(2);
        return dataSource;
    }

    /**
     * Job repository store. Defaults to a private in-memory database, so job and step
     * executions live as long as the process.
     */
    @Bean(name = "batchDataSource")
    public DataSource batchDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("derived-metrics-batch");
        dataSource.setDriverClassName(env.getProperty("spring.datasource.batch.driver-class-name", DEFAULT_BATCH_DRIVER));
        dataSource.setJdbcUrl(env.getProperty("spring.datasource.batch.url", DEFAULT_BATCH_URL));
        dataSource.setUsername(env.getProperty("spring.datasource.batch.username", "sa"));
        dataSource.setPassword(env.getProperty("spring.datasource.batch.password", ""));
        dataSource.setMaximumPoolSize(2);
        return dataSource;
    }

    @Bean(name = "batchTransactionManager")
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    @Bean
    public DataSourceInitializer batchSchemaInitializer(@Qualifier("batchDataSource") DataSource batchDataSource) {
        String schema = env.getProperty("spring.datasource.batch.schema", DEFAULT_BATCH_SCHEMA);
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(batchDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new DefaultResourceLoader().getResource(schema)));
        initializer.setEnabled(env.getProperty("spring.datasource.batch.initialize-schema", Boolean.class, true));
        return initializer;
    }

    @Bean(name = "transactionManager")
    public DataSourceTransactionManager transactionManager(@Qualifier("appDataSource") DataSource appDataSource) {
        return new DataSourceTransactionManager(appDataSource);
    }

    @Bean(name = "appJdbcTemplate")
    public JdbcTemplate appJdbcTemplate(@Qualifier("appDataSource") DataSource appDataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(appDataSource);
        jdbcTemplate.setQueryTimeout(queryTimeoutSeconds());
        return jdbcTemplate;
    }

    @Bean(name = "appNamedParameterJdbcTemplate")
    public NamedParameterJdbcTemplate appNamedParameterJdbcTemplate(@Qualifier("appJdbcTemplate") JdbcTemplate appJdbcTemplate) {
        return new NamedParameterJdbcTemplate(appJdbcTemplate);
    }

    private int queryTimeoutSeconds() {
        return Math.toIntExact(properties.usage().executionTimeout().toSeconds());
    }
}
