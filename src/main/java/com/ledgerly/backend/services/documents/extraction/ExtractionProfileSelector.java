package com.ledgerly.backend.services.documents.extraction;

import java.util.List;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.services.documents.model.DocumentClassification;
import com.ledgerly.backend.services.documents.model.ParsedContent;

import lombok.extern.slf4j.Slf4j;

/**
 * Escolhe um único perfil por documento: assinatura de colunas para conteúdo tabular,
 * banco detectado para texto livre; na falta, os perfis genéricos.
 */
@Component
@Slf4j
public class ExtractionProfileSelector {

    public ExtractionProfile select(ParsedContent content, DocumentClassification classification) {
        if (content.hasRows()) {
            List<String> headers = content.headers();
            for (ExtractionProfile profile : ExtractionProfiles.TABULAR) {
                if (profile.signature() != null && profile.signature().matches(headers)) {
                    log.info("[Extractor] Column signature matched profile={}", profile.describe());
                    return profile;
                }
            }
            log.info("[Extractor] No column signature matched (headers={}); using {}",
                    headers, ExtractionProfiles.GENERIC_COLUMNS.describe());
            return ExtractionProfiles.GENERIC_COLUMNS;
        }

        String bankId = classification != null ? classification.bankId() : null;
        if (bankId != null) {
            for (ExtractionProfile profile : ExtractionProfiles.LINE) {
                if (bankId.equals(profile.bankId())) {
                    log.info("[Extractor] Line profile for bank={} -> {}", bankId, profile.describe());
                    return profile;
                }
            }
        }
        log.info("[Extractor] No line profile for bank={}; using {}", bankId, ExtractionProfiles.GENERIC_LINES.describe());
        return ExtractionProfiles.GENERIC_LINES;
    }
}
