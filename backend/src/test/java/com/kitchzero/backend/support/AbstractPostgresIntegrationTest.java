package com.kitchzero.backend.support;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. The schema comes from the application's own
 * Flyway migrations; every table is emptied after each test. Skipped when no Docker daemon is reachable.
 */
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final Object CONTAINER_LOCK = new Object();
    private static PostgreSQLContainer<?> postgres;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        PostgreSQLContainer<?> container = startedContainer();
        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
    }

    private static PostgreSQLContainer<?> startedContainer() {
        synchronized (CONTAINER_LOCK) {
            if (postgres == null) {
                postgres = new PostgreSQLContainer<>("postgres:16.4")
                        .withDatabaseName("kitchzero_test")
                        .withUsername("kitchzero")
                        .withPassword("kitchzero");
                postgres.start();
            }
            return postgres;
        }
    }

    @AfterEach
    void truncateTables() {
        jdbcTemplate.execute("TRUNCATE TABLE rate_limit_counter, login_attempt, auth_session, app_user CASCADE");
    }
}
