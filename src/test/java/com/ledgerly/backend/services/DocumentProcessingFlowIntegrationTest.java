package com.ledgerly.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import com.ledgerly.backend.classification.CategorizationService;
import com.ledgerly.backend.classification.repository.CategoryRuleRepository;
import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.enums.ExtractionMethod;
import com.ledgerly.backend.enums.PipelineCondition;
import com.ledgerly.backend.enums.ProcessingStatus;
import com.ledgerly.backend.enums.RuleMatchField;
import com.ledgerly.backend.repositories.ExchangeRateEntryRepository;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;
import com.ledgerly.backend.services.currency.ExchangeRateSource;
import com.ledgerly.backend.services.currency.ExchangeRateUnavailableException;
import com.ledgerly.backend.services.currency.ReferenceCurrencyBackfillService;
import com.ledgerly.backend.services.documents.model.DocumentProcessingResult;
import com.ledgerly.backend.services.documents.model.SourceDocument;

@SpringBootTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.datasource.url=jdbc:h2:mem:ledgerly_flow;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "spring.datasource.driverClassName=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.database-platform=org.hibernate.dialect.H2Dialect",
        "ledgerly.ai.api-key="
})
class DocumentProcessingFlowIntegrationTest {

    private static final String HIPOTECARIO_CSV = String.join("\n",
            "FECHA;DESCRIPCION;REFERENCIA;DEBITO EN $;CREDITO EN $",
            "15/01/2024;CAFE MARTINEZ PALERMO;REF-100;1.234,56;",
            "16/01/2024;Acreditación haberes;REF-101;;500.000,00",
            "TOTAL;;;1.234,56;500.000,00");

    @Autowired
    private DocumentProcessingService processingService;

    @Autowired
    private DocumentProcessingJobService jobService;

    @Autowired
    private CategorizationService categorizationService;

    @Autowired
    private ReferenceCurrencyBackfillService backfillService;

    @Autowired
    private LedgerTransactionRepository transactionRepository;

    @Autowired
    private ExchangeRateEntryRepository rateRepository;

    @Autowired
    private CategoryRuleRepository ruleRepository;

    @MockBean
    private ExchangeRateSource exchangeRateSource;

    @AfterEach
    void cleanUp() {
        transactionRepository.deleteAll();
        rateRepository.deleteAll();
        ruleRepository.deleteAll();
    }

    @Test
    void sameStatementTwiceInsertsOnlyOnce() {
        when(exchangeRateSource.sourceName()).thenReturn("test");
        when(exchangeRateSource.fetchRate(any(), anyString(), anyString())).thenReturn(new BigDecimal("1000"));
        UUID owner = UUID.randomUUID();
        UUID coffee = UUID.randomUUID();
        categorizationService.addRule(owner, "CAFE", RuleMatchField.DESCRIPTION, 5, false, false, UUID.randomUUID());
        categorizationService.addRule(owner, "CAFE MARTINEZ", RuleMatchField.DESCRIPTION, 10, false, false, coffee);

        DocumentProcessingResult first = processingService.processDocument(csv(owner));
        DocumentProcessingResult second = processingService.processDocument(csv(owner));

        assertEquals(ProcessingStatus.COMPLETED, first.status());
        assertEquals(2, first.insertedCount());
        assertEquals(0, first.duplicateCount());
        assertEquals(ExtractionMethod.DETERMINISTIC, first.method());
        assertEquals("Banco Hipotecario", first.bankNameGuess());
        assertFalse(first.needsReview());
        assertTrue(first.conditions().contains(PipelineCondition.ROW_PARSE_SKIPPED));

        assertEquals(0, second.insertedCount());
        assertEquals(2, second.duplicateCount());
        assertTrue(second.conditions().contains(PipelineCondition.DUPLICATE_REFERENCE));

        List<LedgerTransaction> stored = transactionRepository.findByOwnerIdOrderByTransactionDateAsc(owner);
        assertEquals(2, stored.size());
        LedgerTransaction coffeeTx = stored.get(0);
        assertEquals(new BigDecimal("-1234.56"), coffeeTx.getAmount());
        assertEquals(0, new BigDecimal("-1.23").compareTo(coffeeTx.getAmountInReferenceCurrency()));
        assertEquals("USD", coffeeTx.getReferenceCurrency());
        assertEquals(coffee, coffeeTx.getCategoryId());
        assertNull(stored.get(1).getCategoryId());
    }

    @Test
    void unavailableRatesStillPersistAndCanBeBackfilled() {
        when(exchangeRateSource.sourceName()).thenReturn("test");
        when(exchangeRateSource.fetchRate(any(), anyString(), anyString()))
                .thenThrow(new ExchangeRateUnavailableException("offline"));
        UUID owner = UUID.randomUUID();

        DocumentProcessingResult result = processingService.processDocument(csv(owner));

        assertEquals(ProcessingStatus.COMPLETED, result.status());
        assertEquals(2, result.insertedCount());
        assertTrue(result.conditions().contains(PipelineCondition.CURRENCY_CONVERSION_UNAVAILABLE));
        assertTrue(transactionRepository.findByOwnerIdOrderByTransactionDateAsc(owner).stream()
                .allMatch(tx -> tx.getAmountInReferenceCurrency() == null));

        when(exchangeRateSource.fetchRate(any(), anyString(), anyString())).thenReturn(new BigDecimal("1000"));
        ReferenceCurrencyBackfillService.BackfillReport report = backfillService.backfillUnconverted(owner);

        assertEquals(2, report.processed());
        assertEquals(2, report.converted());
        assertTrue(transactionRepository.findByOwnerIdOrderByTransactionDateAsc(owner).stream()
                .allMatch(tx -> tx.getAmountInReferenceCurrency() != null));
    }

    @Test
    void unsupportedFormatIsReportedAsyncAsFailure() throws Exception {
        SourceDocument image = SourceDocument.of(UUID.randomUUID(), "recibo.png", "image/png", new byte[] {1, 2, 3});

        DocumentProcessingResult result = jobService.processAsync(image).get(10, TimeUnit.SECONDS);

        assertEquals(ProcessingStatus.FAILED, result.status());
        assertTrue(result.conditions().contains(PipelineCondition.UNSUPPORTED_FORMAT));
    }

    private static SourceDocument csv(UUID owner) {
        return SourceDocument.of(owner, "movimientos.csv", "text/csv", HIPOTECARIO_CSV.getBytes(StandardCharsets.UTF_8));
    }
}
