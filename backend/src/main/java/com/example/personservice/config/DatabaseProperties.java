package com.example.personservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings bound from {@code app.database.*}.
 *
 * @param url             libpq-style {@code postgres://} URL or a {@code jdbc:postgresql:} URL
 * @param username        overrides the user embedded in {@code url} when not blank
 * @param password        overrides the password embedded in {@code url} when not blank
 * @param maximumPoolSize upper bound of the shared connection pool
 */
@ConfigurationProperties(prefix = "app.database")
public record DatabaseProperties(String url, String username, String password, Integer maximumPoolSize) {
}
