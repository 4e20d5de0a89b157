package com.ledgerly.backend.services.documents.classifier;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.services.documents.classifier.BankCatalog.BankIdentity;
import com.ledgerly.backend.services.documents.classifier.DocumentTypeCatalog.DocumentTypeGroup;
import com.ledgerly.backend.services.documents.model.DocumentClassification;
import com.ledgerly.backend.services.documents.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Decide o tipo do documento e o banco emissor a partir do texto extraído.
 *
 * Para cada grupo com ao menos um padrão encontrado:
 * confidence = min(matched/total * 50 + priority/2 + matched * 5, 100), arredondado.
 * Vence a maior confiança; empate vai para a maior prioridade e depois para a ordem do catálogo.
 */
@Component
@Slf4j
public class DocumentClassifier {

    public DocumentClassification classify(String text) {
        if (text == null || text.isBlank()) {
            log.info("[Classifier] Empty text; classification inconclusive");
            return unknown();
        }

        DocumentTypeGroup bestGroup = null;
        int bestConfidence = -1;
        Set<String> bestMatches = Set.of();

        for (DocumentTypeGroup group : DocumentTypeCatalog.GROUPS) {
            Set<String> matched = new LinkedHashSet<>();
            for (Pattern pattern : group.patterns()) {
                if (pattern.matcher(text).find()) {
                    matched.add(pattern.pattern());
                }
            }
            if (matched.isEmpty()) continue;

            int confidence = typeConfidence(matched.size(), group.patterns().size(), group.priority());
            boolean better = confidence > bestConfidence
                    || (confidence == bestConfidence && group.priority() > bestGroup.priority());
            if (better) {
                bestGroup = group;
                bestConfidence = confidence;
                bestMatches = matched;
            }
        }

        BankIdentity bank = detectBank(text);

        DocumentClassification classification = new DocumentClassification(
                bestGroup != null ? bestGroup.id() : DocumentClassification.UNKNOWN,
                bestGroup != null ? bestGroup.name() : DocumentTypeCatalog.UNKNOWN_NAME,
                bestGroup != null ? bestConfidence : 0,
                bestMatches,
                bank != null ? bank.id() : DocumentClassification.UNKNOWN,
                bank != null ? bank.name() : DocumentClassification.UNKNOWN_BANK_NAME,
                bank != null ? 100 : 0);

        log.info("[Classifier] type={} confidence={} matched={} bank={} (catalog {})",
                classification.documentType(),
                classification.typeConfidence(),
                bestMatches.size(),
                classification.bankId(),
                DocumentTypeCatalog.VERSION);
        return classification;
    }

    static int typeConfidence(int matched, int total, int priority) {
        double ratio = total == 0 ? 0.0 : (double) matched / total;
        double confidence = Math.min(ratio * 50 + priority / 2.0 + matched * 5, 100);
        return (int) Math.round(confidence);
    }

    /**
     * Primeira palavra-chave do catálogo presente no texto (sem acentos, minúsculo).
     */
    BankIdentity detectBank(String text) {
        String normalized = NormalizeUtil.normalize(text);
        for (BankIdentity bank : BankCatalog.BANKS) {
            for (String keyword : bank.keywords()) {
                if (normalized.contains(NormalizeUtil.normalize(keyword))) {
                    return bank;
                }
            }
        }
        return null;
    }

    private static DocumentClassification unknown() {
        return new DocumentClassification(
                DocumentClassification.UNKNOWN,
                DocumentTypeCatalog.UNKNOWN_NAME,
                0,
                Set.of(),
                DocumentClassification.UNKNOWN,
                DocumentClassification.UNKNOWN_BANK_NAME,
                0);
    }
}
