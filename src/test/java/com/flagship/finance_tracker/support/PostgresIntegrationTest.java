package com.flagship.finance_tracker.support;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base for tests that run the whole application against PostgreSQL.
 *
 * One container is started lazily for the JVM and shared by every
 * subclass, so the cached Spring context always points at a live
 * database. Kafka is pointed at a dead port and the outbox publisher is
 * off; events stay in the outbox table where tests can inspect them.
 * Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresIntegrationTest {

    private static PostgreSQLContainer<?> postgres;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        startPostgres();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("metrics.refresh.enabled", () -> "false");
    }

    private static synchronized void startPostgres() {
        if (postgres == null) {
            postgres = new PostgreSQLContainer<>("postgres:16")
                .withDatabaseName("finance_tracker_test")
                .withUsername("test")
                .withPassword("test");
            postgres.start();
        }
    }

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }
}
