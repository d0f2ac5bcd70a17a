package com.tracelake.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Connection pool for the embedded DuckDB analytics engine.
 *
 * The pool does not fail startup when DuckDB cannot be loaded; the engine
 * then reports itself unavailable and queries use the Parquet scan fallback.
 */
@Configuration
public class AnalyticsEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(AnalyticsEngineConfig.class);

    @Value("${tracelake.query.duckdb.url:jdbc:duckdb:}")
    private String url;

    @Value("${tracelake.query.duckdb.pool-size:4}")
    private int poolSize;

    @Bean(name = "duckDbDataSource", destroyMethod = "close")
    public HikariDataSource duckDbDataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("duckdb");
        config.setJdbcUrl(url);
        config.setDriverClassName("org.duckdb.DuckDBDriver");

        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(10000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        // start even if the native library cannot be loaded
        config.setInitializationFailTimeout(-1);

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("DuckDB DataSource initialized: {} (pool size {})", url, poolSize);
        return dataSource;
    }

    @Bean(name = "duckDbJdbcTemplate")
    public JdbcTemplate duckDbJdbcTemplate(@Qualifier("duckDbDataSource") DataSource duckDbDataSource) {
        return new JdbcTemplate(duckDbDataSource);
    }
}
