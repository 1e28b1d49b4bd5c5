package com.example.personservice.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Slf4j
@Configuration
public class DataSourceConfig {

    private static final int DEFAULT_POOL_SIZE = 10;

    @Bean
    public DataSource dataSource(DatabaseProperties properties) {
        DatabaseUrl url = DatabaseUrl.parse(properties.url())
                .withCredentials(properties.username(), properties.password());

        HikariConfig config = new HikariConfig();
        config.setPoolName("persons-pool");
        config.setJdbcUrl(url.jdbcUrl());
        config.setUsername(url.username());
        config.setPassword(url.password());
        config.setMaximumPoolSize(properties.maximumPoolSize() != null
                ? properties.maximumPoolSize()
                : DEFAULT_POOL_SIZE);
        // fail startup when the database is unreachable
        config.setInitializationFailTimeout(1);

        log.info("Connecting to {} as {}", url.jdbcUrl(), url.username());
        return new HikariDataSource(config);
    }
}
