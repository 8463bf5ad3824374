package com.tagstore.storage;

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
 * Configuration for the ClickHouse JDBC connection backing the analytics engine
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${tagstore.clickhouse.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${tagstore.clickhouse.username:default}")
    private String username;

    @Value("${tagstore.clickhouse.password:}")
    private String password;

    @Value("${tagstore.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${tagstore.clickhouse.max-execution-seconds:30}")
    private int maxExecutionSeconds;

    /**
     * Create ClickHouse DataSource with connection pooling
     */
    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
        config.setPoolName("tagstore-clickhouse");

        // Connection pool settings
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        // Queries are read-only snapshot reads; the server enforces the time budget
        config.setReadOnly(true);
        config.addDataSourceProperty("compress", "true");
        config.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionSeconds));

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("ClickHouse DataSource initialized: {} (pool size {})", url, poolSize);
        return dataSource;
    }

    /**
     * Create JdbcTemplate for ClickHouse queries
     */
    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }
}
