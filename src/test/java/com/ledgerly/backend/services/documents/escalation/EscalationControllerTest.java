package com.ledgerly.backend.services.documents.escalation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ledgerly.backend.config.PipelineProperties;
import com.ledgerly.backend.enums.ExtractionMethod;
import com.ledgerly.backend.services.documents.model.ExtractionResult;
import com.ledgerly.backend.services.documents.model.ParsedContent;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;
import com.ledgerly.backend.services.quota.AiUsageQuotaService;
import com.ledgerly.backend.services.quota.QuotaState;

@ExtendWith(MockitoExtension.class)
class EscalationControllerTest {

    private static final UUID OWNER = UUID.randomUUID();
    private static final ParsedContent CONTENT = ParsedContent.textOnly("15/01/2024 algo 10,00");

    @Mock
    private AiUsageQuotaService quotaService;

    @Mock
    private EnhancedExtractionClient aiClient;

    private PipelineProperties properties;
    private EscalationController controller;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        controller = new EscalationController(properties, quotaService, aiClient);
    }

    @Test
    @DisplayName("Confiança 59 com cota: chama a IA uma vez e marca tudo para revisão")
    void belowThresholdInvokesAiOnceAndForcesReview() throws Exception {
        when(aiClient.isAvailable()).thenReturn(true);
        when(quotaService.checkQuota(OWNER)).thenReturn(new QuotaState(OWNER, "2024-01", 3, 20));
        when(quotaService.tryAcquire(OWNER)).thenReturn(true);
        when(aiClient.extract(anyString(), any())).thenReturn(aiResult(100));

        EscalationOutcome outcome = controller.resolve(deterministic(59), CONTENT, "doc.pdf", OWNER);

        verify(aiClient, times(1)).extract(anyString(), any());
        verify(quotaService, never()).release(any());
        assertEquals(EscalationDecision.AI_ACCEPTED, outcome.decision());
        assertEquals(ExtractionMethod.AI_ASSISTED, outcome.result().method());
        assertTrue(outcome.needsReview());
        assertEquals(2, outcome.result().candidates().size());
        assertTrue(outcome.result().candidates().stream().allMatch(TransactionCandidate::isNeedsReview));
        assertTrue(outcome.result().candidates().stream().allMatch(TransactionCandidate::isProcessedByAi));
    }

    @Test
    void thresholdIsInclusiveOnTheHighSide() throws Exception {
        ExtractionResult deterministic = deterministic(60);

        EscalationOutcome outcome = controller.resolve(deterministic, CONTENT, "doc.pdf", OWNER);

        assertEquals(EscalationDecision.NOT_NEEDED, outcome.decision());
        assertEquals(ExtractionMethod.DETERMINISTIC, outcome.result().method());
        assertFalse(outcome.needsReview());
        assertFalse(outcome.result().candidates().get(0).isNeedsReview());
        verify(aiClient, never()).extract(anyString(), any());
        verify(quotaService, never()).checkQuota(any());
    }

    @Test
    void exhaustedQuotaKeepsDeterministicResultForReview() throws Exception {
        when(aiClient.isAvailable()).thenReturn(true);
        when(quotaService.checkQuota(OWNER)).thenReturn(new QuotaState(OWNER, "2024-01", 20, 20));

        EscalationOutcome outcome = controller.resolve(deterministic(40), CONTENT, "doc.pdf", OWNER);

        assertEquals(EscalationDecision.QUOTA_EXHAUSTED, outcome.decision());
        assertTrue(outcome.escalationUnavailable());
        assertEquals(ExtractionMethod.DETERMINISTIC, outcome.result().method());
        assertTrue(outcome.needsReview());
        assertTrue(outcome.result().candidates().get(0).isNeedsReview());
        verify(quotaService, never()).tryAcquire(any());
        verify(aiClient, never()).extract(anyString(), any());
    }

    @Test
    void lostAcquireRaceCountsAsExhausted() throws Exception {
        when(aiClient.isAvailable()).thenReturn(true);
        when(quotaService.checkQuota(OWNER)).thenReturn(new QuotaState(OWNER, "2024-01", 19, 20));
        when(quotaService.tryAcquire(OWNER)).thenReturn(false);

        EscalationOutcome outcome = controller.resolve(deterministic(40), CONTENT, "doc.pdf", OWNER);

        assertEquals(EscalationDecision.QUOTA_EXHAUSTED, outcome.decision());
        verify(aiClient, never()).extract(anyString(), any());
    }

    @Test
    void unavailableCapabilityDoesNotTouchQuota() throws Exception {
        when(aiClient.isAvailable()).thenReturn(false);

        EscalationOutcome outcome = controller.resolve(deterministic(10), CONTENT, "doc.pdf", OWNER);

        assertEquals(EscalationDecision.CAPABILITY_UNAVAILABLE, outcome.decision());
        assertTrue(outcome.needsReview());
        verify(quotaService, never()).checkQuota(any());
        verify(quotaService, never()).tryAcquire(any());
    }

    @Test
    void failedAiCallReleasesQuotaAndFallsBackToHybrid() throws Exception {
        when(aiClient.isAvailable()).thenReturn(true);
        when(quotaService.checkQuota(OWNER)).thenReturn(new QuotaState(OWNER, "2024-01", 0, 20));
        when(quotaService.tryAcquire(OWNER)).thenReturn(true);
        when(aiClient.extract(anyString(), any())).thenThrow(new EnhancedExtractionException("timeout"));

        ExtractionResult deterministic = deterministic(30);
        EscalationOutcome outcome = controller.resolve(deterministic, CONTENT, "doc.pdf", OWNER);

        verify(quotaService, times(1)).release(OWNER);
        assertEquals(EscalationDecision.AI_FAILED, outcome.decision());
        assertEquals(ExtractionMethod.HYBRID, outcome.result().method());
        assertTrue(outcome.needsReview());
        assertEquals(deterministic.candidates().get(0).getAmount(), outcome.result().candidates().get(0).getAmount());
        assertFalse(outcome.result().candidates().get(0).isProcessedByAi());
    }

    @Test
    void emptyAiAnswerReleasesQuotaAndKeepsDeterministicCandidates() throws Exception {
        when(aiClient.isAvailable()).thenReturn(true);
        when(quotaService.checkQuota(OWNER)).thenReturn(new QuotaState(OWNER, "2024-01", 0, 20));
        when(quotaService.tryAcquire(OWNER)).thenReturn(true);
        when(aiClient.extract(anyString(), any())).thenReturn(
                new ExtractionResult(List.of(), null, null, 95, ExtractionMethod.AI_ASSISTED, "openai-responses", 0));

        ExtractionResult deterministic = deterministic(30);
        EscalationOutcome outcome = controller.resolve(deterministic, CONTENT, "doc.pdf", OWNER);

        verify(quotaService, times(1)).release(OWNER);
        assertEquals(EscalationDecision.AI_FAILED, outcome.decision());
        assertEquals(ExtractionMethod.HYBRID, outcome.result().method());
        assertEquals(1, outcome.result().candidates().size());
        assertTrue(outcome.needsReview());
    }

    @Test
    void thresholdIsConfigurable() throws Exception {
        properties.setEscalationThreshold(30);
        ExtractionResult deterministic = deterministic(40);

        EscalationOutcome outcome = controller.resolve(deterministic, CONTENT, "doc.pdf", OWNER);

        assertEquals(EscalationDecision.NOT_NEEDED, outcome.decision());
        assertSame(deterministic.candidates().get(0).getDate(), outcome.result().candidates().get(0).getDate());
    }

    private static ExtractionResult deterministic(int confidence) {
        TransactionCandidate tx = TransactionCandidate.builder()
                .date(LocalDate.of(2024, 1, 15))
                .description("algo")
                .amount(new BigDecimal("10.00"))
                .extractionConfidence(75)
                .currency("ARS")
                .build();
        return new ExtractionResult(List.of(tx), null, null, confidence, ExtractionMethod.DETERMINISTIC, "generic-lines", 0);
    }

    private static ExtractionResult aiResult(int confidence) {
        List<TransactionCandidate> txs = List.of(
                TransactionCandidate.builder().date(LocalDate.of(2024, 1, 15)).description("NETFLIX")
                        .amount(new BigDecimal("-1234.56")).extractionConfidence(confidence).currency("ARS").build(),
                TransactionCandidate.builder().date(LocalDate.of(2024, 1, 16)).description("Sueldo")
                        .amount(new BigDecimal("500000.00")).extractionConfidence(confidence).currency("ARS").build());
        return new ExtractionResult(txs, "Brubank", null, confidence, ExtractionMethod.AI_ASSISTED, "openai-responses", 0);
    }
}
