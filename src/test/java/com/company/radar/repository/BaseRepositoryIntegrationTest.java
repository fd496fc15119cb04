package com.company.radar.repository;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.core.AutoConfigureCache;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.UUID;

/**
 * Repositories against a real PostgreSQL with schema.sql applied. Tests run
 * outside a test transaction and every statement commits; tables are emptied
 * before each test instead.
 */
@JdbcTest
@AutoConfigureCache
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseRepositoryIntegrationTest {

    // One container for every subclass; the cached Spring context keeps pointing at it
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
                    .withDatabaseName("search_radar_test")
                    .withUsername("test")
                    .withPassword("test");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.execute("TRUNCATE accounts CASCADE");
    }

    protected UUID createAccount(String email) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO accounts (google_email, data_initialized) VALUES (?, true) RETURNING id",
                UUID.class, email);
    }

    protected UUID createProperty(UUID accountId, String siteUrl) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO properties (account_id, site_url, permission_level) VALUES (?, ?, 'siteOwner') RETURNING id",
                UUID.class, accountId, siteUrl);
    }
}
