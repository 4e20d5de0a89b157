package com.ledgerly.backend.services.currency;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Reprocessa transações gravadas sem valor na moeda de referência (ex.: fonte de cotação fora do ar).
 * Percorre todas as pendentes em lotes de 50, cada lote na sua transação; as que continuam sem
 * cotação não impedem que as seguintes sejam convertidas.
 */
@Service
@Slf4j
public class ReferenceCurrencyBackfillService {

    static final int BATCH_SIZE = 50;

    private final LedgerTransactionRepository transactionRepository;
    private final CurrencyNormalizer currencyNormalizer;
    private final TransactionTemplate transactionTemplate;

    public ReferenceCurrencyBackfillService(LedgerTransactionRepository transactionRepository,
                                            CurrencyNormalizer currencyNormalizer,
                                            PlatformTransactionManager transactionManager) {
        this.transactionRepository = transactionRepository;
        this.currencyNormalizer = currencyNormalizer;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public record BackfillReport(int processed, int converted, int failed) {}

    public BackfillReport backfillUnconverted(UUID ownerId) {
        String referenceCurrency = currencyNormalizer.referenceCurrency();
        List<UUID> pending = transactionRepository.findUnconvertedIds(ownerId, referenceCurrency);

        int converted = 0;
        for (int from = 0; from < pending.size(); from += BATCH_SIZE) {
            List<UUID> batch = pending.subList(from, Math.min(from + BATCH_SIZE, pending.size()));
            Integer batchConverted = transactionTemplate.execute(status -> convertBatch(batch, referenceCurrency));
            converted += batchConverted == null ? 0 : batchConverted;
        }

        int failed = pending.size() - converted;
        log.info("[Currency] Backfill owner={} processed={} converted={} failed={}",
                ownerId, pending.size(), converted, failed);
        return new BackfillReport(pending.size(), converted, failed);
    }

    private int convertBatch(List<UUID> ids, String referenceCurrency) {
        int converted = 0;
        for (LedgerTransaction tx : transactionRepository.findAllById(ids)) {
            ConvertedAmount result = currencyNormalizer.toReferenceCurrency(
                    tx.getAmount(), tx.getCurrency(), tx.getTransactionDate());
            if (result == null) {
                log.debug("[Currency] Backfill still unavailable id={} currency={} date={}",
                        tx.getId(), tx.getCurrency(), tx.getTransactionDate());
                continue;
            }
            tx.setAmountInReferenceCurrency(result.amount());
            tx.setReferenceCurrency(referenceCurrency);
            tx.setExchangeRate(result.rate());
            tx.setExchangeRateDate(result.rateDate());
            converted++;
        }
        return converted;
    }
}
