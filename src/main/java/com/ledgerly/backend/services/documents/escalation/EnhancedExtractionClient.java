package com.ledgerly.backend.services.documents.escalation;

import com.ledgerly.backend.services.documents.model.ExtractionResult;

/**
 * Extração de alto custo usada quando a extração determinística tem pouca confiança.
 */
public interface EnhancedExtractionClient {

    /**
     * @return false quando o serviço não está configurado ou desabilitado
     */
    boolean isAvailable();

    ExtractionResult extract(String text, String fileName) throws EnhancedExtractionException;
}
