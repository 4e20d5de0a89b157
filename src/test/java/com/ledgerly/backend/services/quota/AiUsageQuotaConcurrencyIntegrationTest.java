package com.ledgerly.backend.services.quota;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.ledgerly.backend.config.AiExtractionProperties;

/**
 * Uploads paralelos do mesmo usuário contra o PostgreSQL real (schema via Flyway).
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({AiUsageQuotaService.class, AiExtractionProperties.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class AiUsageQuotaConcurrencyIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("ledgerly_test")
            .withUsername("ledgerly")
            .withPassword("ledgerly");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");

        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", postgres::getDriverClassName);
    }

    @Autowired
    private AiUsageQuotaService quotaService;

    @Test
    void parallelAcquiresNeverExceedTheLimit() throws Exception {
        UUID owner = UUID.randomUUID();
        quotaService.updateLimit(owner, 5);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 24; i++) {
                calls.add(() -> quotaService.tryAcquire(owner));
            }

            int granted = 0;
            for (Future<Boolean> f : pool.invokeAll(calls)) {
                if (f.get()) granted++;
            }

            assertEquals(5, granted);
            assertEquals(5, quotaService.checkQuota(owner).used());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void firstAcquiresForANewPeriodRaceSafely() throws Exception {
        UUID owner = UUID.randomUUID();

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                calls.add(() -> quotaService.tryAcquire(owner));
            }

            int granted = 0;
            for (Future<Boolean> f : pool.invokeAll(calls)) {
                if (f.get()) granted++;
            }

            assertEquals(6, granted);
            assertEquals(6, quotaService.checkQuota(owner).used());
        } finally {
            pool.shutdownNow();
        }
    }
}
