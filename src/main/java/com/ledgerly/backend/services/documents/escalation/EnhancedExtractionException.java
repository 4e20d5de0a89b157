package com.ledgerly.backend.services.documents.escalation;

/**
 * Falha da extração assistida (transporte, resposta vazia ou JSON inválido).
 */
public class EnhancedExtractionException extends Exception {

    public EnhancedExtractionException(String message) {
        super(message);
    }

    public EnhancedExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
