package com.flagship.points_ledger;

import com.flagship.points_ledger.config.AppSettingsCache;
import com.flagship.points_ledger.jobs.TestJobHandlers;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Base class for tests that need the full application against PostgreSQL.
 *
 * One container is started for the whole test run and every subclass shares
 * one Spring context. The scheduled poller is disabled so tests drive the
 * worker explicitly, and Redis is replaced by a mock.
 */
@SpringBootTest
@Import(TestJobHandlers.class)
public abstract class AbstractIntegrationTest {

    protected static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("points_ledger_test")
            .withUsername("test")
            .withPassword("test");

    static {
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> "20");
        registry.add("jobs.worker.enabled", () -> "false");
        registry.add("jobs.worker.max-attempts", () -> "3");
        registry.add("jobs.retry.base-backoff-ms", () -> "0");
        registry.add("metrics.refresh.interval", () -> "3600000");
    }

    @MockBean
    protected StringRedisTemplate redisTemplate;

    protected ValueOperations<String, String> valueOperations;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected AppSettingsCache appSettings;

    @BeforeEach
    void resetDatabaseAndRedis() {
        valueOperations = mock();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        jdbcTemplate.execute(
            "TRUNCATE ledger_entries, withdraw_requests, idempotency_keys, jobs, accounts RESTART IDENTITY CASCADE");
        jdbcTemplate.update("UPDATE app_settings SET value = '1' WHERE key = 'withdraw_min_amount'");
        jdbcTemplate.update("UPDATE app_settings SET value = 'false' WHERE key = 'jobs_paused'");
        appSettings.forceRefresh();
    }

    protected long countRows(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0L;
    }

    protected long cachedBalance(long accountId) {
        Long balance = jdbcTemplate.queryForObject("SELECT balance FROM accounts WHERE id = ?", Long.class, accountId);
        return balance != null ? balance : 0L;
    }

    protected String jobStatus(long jobId) {
        return jdbcTemplate.queryForObject("SELECT status FROM jobs WHERE id = ?", String.class, jobId);
    }

    protected int jobAttempts(long jobId) {
        Integer attempts = jdbcTemplate.queryForObject("SELECT attempts FROM jobs WHERE id = ?", Integer.class, jobId);
        return attempts != null ? attempts : 0;
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
