package com.ledgerly.backend.services.documents.extraction;

import org.springframework.stereotype.Service;

import com.ledgerly.backend.enums.ExtractionMethod;
import com.ledgerly.backend.services.documents.model.DocumentClassification;
import com.ledgerly.backend.services.documents.model.ExtractionResult;
import com.ledgerly.backend.services.documents.model.ParsedContent;
import com.ledgerly.backend.services.documents.quality.PipelineConfidenceEvaluator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Extração determinística: escolhe um perfil, aplica o extrator correspondente e pontua o resultado.
 * Um documento sem transações devolve um resultado vazio com confiança 0; reagir a isso é papel
 * da escalação.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionEngine {

    private final ExtractionProfileSelector profileSelector;
    private final TabularExtractor tabularExtractor;
    private final LineExtractor lineExtractor;
    private final PipelineConfidenceEvaluator confidenceEvaluator;

    public ExtractionResult extract(ParsedContent content, DocumentClassification classification, String fileName) {
        ExtractionProfile profile = profileSelector.select(content, classification);
        return extractWith(profile, content, fileName);
    }

    public ExtractionResult extractWith(ExtractionProfile profile, ParsedContent content, String fileName) {
        ProfileExtraction extraction = profile.kind().isTabular()
                ? tabularExtractor.extract(content.rows(), profile)
                : lineExtractor.extract(content.text(), profile);

        int confidence = confidenceEvaluator.evaluate(extraction.candidates());

        log.info("[Extractor] file={} profile={} candidates={} skipped={} confidence={}",
                fileName,
                profile.describe(),
                extraction.candidates().size(),
                extraction.skippedRows(),
                confidence);

        return new ExtractionResult(
                extraction.candidates(),
                profile.bankName(),
                extraction.statementDate(),
                confidence,
                ExtractionMethod.DETERMINISTIC,
                profile.id(),
                extraction.skippedRows());
    }
}
