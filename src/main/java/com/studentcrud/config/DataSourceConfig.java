package com.studentcrud.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

/**
 * Database wiring.
 *
 * CONNECTION MODEL:
 * - No pool: DriverManagerDataSource opens a fresh physical connection on every request
 * - JdbcTemplate acquires one connection per statement and releases it on every exit path
 * - Statements run in auto-commit mode, there is no transaction manager in play
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    @Bean
    public DatabaseSettings databaseSettings(Environment environment) {
        DatabaseSettings settings = DatabaseSettings.resolve(environment::getProperty);
        log.info("Resolved database settings: {}", settings);
        return settings;
    }

    @Bean
    public DataSource dataSource(DatabaseSettings settings) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                settings.jdbcUrl(), settings.user(), settings.password());
        dataSource.setDriverClassName("org.postgresql.Driver");
        return dataSource;
    }

    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }
}
