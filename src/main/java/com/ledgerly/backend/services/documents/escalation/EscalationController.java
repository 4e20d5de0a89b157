package com.ledgerly.backend.services.documents.escalation;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.config.PipelineProperties;
import com.ledgerly.backend.enums.ExtractionMethod;
import com.ledgerly.backend.services.documents.model.ExtractionResult;
import com.ledgerly.backend.services.documents.model.ParsedContent;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;
import com.ledgerly.backend.services.quota.AiUsageQuotaService;
import com.ledgerly.backend.services.quota.QuotaState;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decide se o resultado determinístico é final ou se a extração por IA deve ser tentada.
 *
 * confidence >= threshold: final, sem revisão.
 * confidence < threshold:
 *   - cota e IA disponíveis: chama a IA; sucesso substitui o resultado (ai-assisted),
 *     falha (ou resposta sem transações) mantém o determinístico (hybrid). Ambos vão para revisão.
 *   - sem cota ou sem IA: mantém o determinístico, marcado para revisão.
 *
 * A unidade de cota é reservada antes da chamada e devolvida se ela falhar, de forma que
 * o uso nunca passa do limite e só chamadas bem-sucedidas ficam contabilizadas.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscalationController {

    private final PipelineProperties pipelineProperties;
    private final AiUsageQuotaService quotaService;
    private final EnhancedExtractionClient enhancedExtractionClient;

    public EscalationOutcome resolve(ExtractionResult deterministic, ParsedContent content, String fileName, UUID ownerId) {
        int threshold = pipelineProperties.getEscalationThreshold();
        if (deterministic.pipelineConfidence() >= threshold) {
            log.info("[Escalation] confidence={} >= {}; deterministic result is final",
                    deterministic.pipelineConfidence(), threshold);
            return new EscalationOutcome(deterministic.withMethod(ExtractionMethod.DETERMINISTIC),
                    EscalationDecision.NOT_NEEDED, false);
        }

        log.info("[Escalation] confidence={} < {}; evaluating AI extraction for owner={}",
                deterministic.pipelineConfidence(), threshold, ownerId);

        if (!enhancedExtractionClient.isAvailable()) {
            log.warn("[Escalation] AI extraction not configured; keeping deterministic result for review");
            return review(deterministic, ExtractionMethod.DETERMINISTIC, EscalationDecision.CAPABILITY_UNAVAILABLE);
        }

        QuotaState quota = quotaService.checkQuota(ownerId);
        if (!quota.available() || !quotaService.tryAcquire(ownerId)) {
            log.warn("[Escalation] AI quota exhausted owner={} used={}/{} period={}",
                    ownerId, quota.used(), quota.limit(), quota.periodKey());
            return review(deterministic, ExtractionMethod.DETERMINISTIC, EscalationDecision.QUOTA_EXHAUSTED);
        }

        ExtractionResult enhanced;
        try {
            enhanced = enhancedExtractionClient.extract(content.text(), fileName);
        } catch (EnhancedExtractionException | RuntimeException e) {
            quotaService.release(ownerId);
            log.warn("[Escalation] AI extraction failed for file={}: {}", fileName, e.getMessage());
            return review(deterministic, ExtractionMethod.HYBRID, EscalationDecision.AI_FAILED);
        }
        if (enhanced == null || enhanced.isEmpty()) {
            quotaService.release(ownerId);
            log.warn("[Escalation] AI extraction returned no transactions for file={}; keeping deterministic result",
                    fileName);
            return review(deterministic, ExtractionMethod.HYBRID, EscalationDecision.AI_FAILED);
        }

        log.info("[Escalation] AI extraction accepted: {} candidates (deterministic had {})",
                enhanced.candidates().size(), deterministic.candidates().size());

        boolean review = pipelineProperties.isForceReviewOnAi();
        ExtractionResult accepted = markCandidates(enhanced, review, true).withMethod(ExtractionMethod.AI_ASSISTED);
        return new EscalationOutcome(accepted, EscalationDecision.AI_ACCEPTED, review);
    }

    private static EscalationOutcome review(ExtractionResult result, ExtractionMethod method, EscalationDecision decision) {
        return new EscalationOutcome(markCandidates(result, true, false).withMethod(method), decision, true);
    }

    private static ExtractionResult markCandidates(ExtractionResult result, boolean needsReview, boolean processedByAi) {
        List<TransactionCandidate> marked = result.candidates().stream()
                .map(c -> c.toBuilder()
                        .needsReview(c.isNeedsReview() || needsReview)
                        .processedByAi(processedByAi)
                        .build())
                .toList();
        return result.withCandidates(marked);
    }
}
