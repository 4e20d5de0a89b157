package com.ledgerly.backend.services.quota;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.ledgerly.backend.config.AiExtractionProperties;
import com.ledgerly.backend.entities.AiUsageQuota;
import com.ledgerly.backend.repositories.AiUsageQuotaRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Cota mensal de extrações por IA.
 *
 * A consulta ({@link #checkQuota}) nunca escreve. A concessão ({@link #tryAcquire}) é um único
 * update condicional no banco, então chamadas concorrentes nunca passam do limite.
 */
@Service
@Slf4j
public class AiUsageQuotaService {

    private final AiUsageQuotaRepository repository;
    private final AiExtractionProperties aiProperties;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    @Autowired
    public AiUsageQuotaService(AiUsageQuotaRepository repository,
                               AiExtractionProperties aiProperties,
                               PlatformTransactionManager transactionManager) {
        this(repository, aiProperties, transactionManager, Clock.systemUTC());
    }

    // Package-private for tests
    AiUsageQuotaService(AiUsageQuotaRepository repository,
                        AiExtractionProperties aiProperties,
                        PlatformTransactionManager transactionManager,
                        Clock clock) {
        this.repository = repository;
        this.aiProperties = aiProperties;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public String currentPeriodKey() {
        return YearMonth.now(clock).toString();
    }

    @Transactional(readOnly = true)
    public QuotaState checkQuota(UUID ownerId) {
        String periodKey = currentPeriodKey();
        return repository.findByOwnerIdAndPeriodKey(ownerId, periodKey)
                .map(AiUsageQuotaService::toState)
                .orElseGet(() -> new QuotaState(ownerId, periodKey, 0, defaultLimit()));
    }

    /**
     * Reserva uma unidade da cota do período atual.
     *
     * @return true quando a unidade foi concedida
     */
    @Transactional
    public boolean tryAcquire(UUID ownerId) {
        String periodKey = currentPeriodKey();
        ensureRow(ownerId, periodKey);

        boolean granted = repository.incrementIfBelowLimit(ownerId, periodKey, now()) == 1;
        log.info("[Quota] acquire owner={} period={} granted={}", ownerId, periodKey, granted);
        return granted;
    }

    /**
     * Devolve uma unidade reservada que não chegou a ser usada com sucesso.
     */
    @Transactional
    public void release(UUID ownerId) {
        String periodKey = currentPeriodKey();
        int updated = repository.decrementIfPositive(ownerId, periodKey, now());
        log.info("[Quota] release owner={} period={} released={}", ownerId, periodKey, updated == 1);
    }

    @Transactional
    public void resetUsage(UUID ownerId, String periodKey) {
        String period = periodKey != null ? periodKey : currentPeriodKey();
        int updated = repository.resetUsage(ownerId, period, now());
        log.info("[Quota] reset owner={} period={} rows={}", ownerId, period, updated);
    }

    @Transactional
    public QuotaState updateLimit(UUID ownerId, int newLimit) {
        if (newLimit <= 0) {
            throw new IllegalArgumentException("Monthly limit must be positive: " + newLimit);
        }
        String periodKey = currentPeriodKey();
        ensureRow(ownerId, periodKey);
        repository.updateLimit(ownerId, periodKey, newLimit, now());
        log.info("[Quota] limit updated owner={} period={} limit={}", ownerId, periodKey, newLimit);
        return checkQuota(ownerId);
    }

    @Transactional(readOnly = true)
    public List<QuotaState> getUsageHistory(UUID ownerId, int months) {
        int size = Math.max(1, months);
        return repository.findByOwnerIdOrderByPeriodKeyDesc(ownerId, PageRequest.of(0, size))
                .stream()
                .map(AiUsageQuotaService::toState)
                .toList();
    }

    private void ensureRow(UUID ownerId, String periodKey) {
        Optional<AiUsageQuota> existing = repository.findByOwnerIdAndPeriodKey(ownerId, periodKey);
        if (existing.isPresent()) return;

        try {
            requiresNew.executeWithoutResult(status -> repository.saveAndFlush(AiUsageQuota.builder()
                    .ownerId(ownerId)
                    .periodKey(periodKey)
                    .usageCount(0)
                    .monthlyLimit(defaultLimit())
                    .build()));
        } catch (DataIntegrityViolationException e) {
            // outra execução criou a linha primeiro
            log.debug("[Quota] row for owner={} period={} already created concurrently", ownerId, periodKey);
        }
    }

    private int defaultLimit() {
        return aiProperties != null && aiProperties.getMonthlyLimit() > 0 ? aiProperties.getMonthlyLimit() : 20;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static QuotaState toState(AiUsageQuota quota) {
        return new QuotaState(quota.getOwnerId(), quota.getPeriodKey(), quota.getUsageCount(), quota.getMonthlyLimit());
    }
}
