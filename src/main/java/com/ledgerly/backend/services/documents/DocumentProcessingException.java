package com.ledgerly.backend.services.documents;

/**
 * Falha que impede o processamento de um documento inteiro.
 */
public class DocumentProcessingException extends RuntimeException {

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
