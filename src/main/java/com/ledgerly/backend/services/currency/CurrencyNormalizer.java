package com.ledgerly.backend.services.currency;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import com.ledgerly.backend.config.PipelineProperties;
import com.ledgerly.backend.entities.ExchangeRateEntry;
import com.ledgerly.backend.repositories.ExchangeRateEntryRepository;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;

import lombok.extern.slf4j.Slf4j;

/**
 * Converte valores para a moeda de referência. Best-effort: qualquer falha resulta em null,
 * nunca em exceção, e a transação segue sem valor convertido.
 */
@Service
@Slf4j
public class CurrencyNormalizer {

    private final ExchangeRateEntryRepository rateRepository;
    private final ExchangeRateSource rateSource;
    private final PipelineProperties pipelineProperties;
    private final TransactionTemplate requiresNew;

    public CurrencyNormalizer(ExchangeRateEntryRepository rateRepository,
                              ExchangeRateSource rateSource,
                              PipelineProperties pipelineProperties,
                              PlatformTransactionManager transactionManager) {
        this.rateRepository = rateRepository;
        this.rateSource = rateSource;
        this.pipelineProperties = pipelineProperties;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * @return valor convertido (2 casas, HALF_UP), ou null quando a cotação não está disponível
     */
    public ConvertedAmount toReferenceCurrency(BigDecimal amount, String currency, LocalDate date) {
        if (amount == null || currency == null || date == null) return null;

        String from = currency.trim().toUpperCase(Locale.ROOT);
        String to = referenceCurrency();
        if (from.equals(to)) {
            return new ConvertedAmount(amount.setScale(2, RoundingMode.HALF_UP), BigDecimal.ONE, date);
        }

        try {
            BigDecimal rate = findOrFetchRate(date, from, to);
            BigDecimal converted = amount.divide(rate, 2, RoundingMode.HALF_UP);
            return new ConvertedAmount(converted, rate, date);
        } catch (Exception e) {
            log.warn("[Currency] Conversion unavailable {}->{} on {}: {}", from, to, date, e.getMessage());
            return null;
        }
    }

    /**
     * Aplica a conversão a cada candidato; os que falharem seguem com o valor convertido nulo.
     */
    public List<TransactionCandidate> normalizeAll(List<TransactionCandidate> candidates) {
        List<TransactionCandidate> out = new ArrayList<>();
        for (TransactionCandidate c : candidates) {
            ConvertedAmount converted = toReferenceCurrency(c.getAmount(), c.getCurrency(), c.getDate());
            if (converted == null) {
                out.add(c);
                continue;
            }
            out.add(c.toBuilder()
                    .amountInReferenceCurrency(converted.amount())
                    .exchangeRate(converted.rate())
                    .exchangeRateDate(converted.rateDate())
                    .build());
        }
        return out;
    }

    public String referenceCurrency() {
        String ref = pipelineProperties.getReferenceCurrency();
        return ref == null ? "USD" : ref.trim().toUpperCase(Locale.ROOT);
    }

    private BigDecimal findOrFetchRate(LocalDate date, String from, String to) {
        Optional<ExchangeRateEntry> cached = rateRepository.findByRateDateAndFromCurrencyAndToCurrency(date, from, to);
        if (cached.isPresent()) {
            return cached.get().getRate();
        }

        BigDecimal rate = rateSource.fetchRate(date, from, to);
        try {
            requiresNew.executeWithoutResult(status -> rateRepository.saveAndFlush(ExchangeRateEntry.builder()
                    .rateDate(date)
                    .fromCurrency(from)
                    .toCurrency(to)
                    .rate(rate)
                    .source(rateSource.sourceName())
                    .build()));
        } catch (DataIntegrityViolationException e) {
            // Outra execução gravou a mesma data/par antes; a cotação gravada prevalece.
            return rateRepository.findByRateDateAndFromCurrencyAndToCurrency(date, from, to)
                    .map(ExchangeRateEntry::getRate)
                    .orElse(rate);
        }
        return rate;
    }
}
