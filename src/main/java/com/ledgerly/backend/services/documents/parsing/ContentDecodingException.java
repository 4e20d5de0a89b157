package com.ledgerly.backend.services.documents.parsing;

import com.ledgerly.backend.services.documents.DocumentProcessingException;

/**
 * Thrown when a decoding library cannot read the bytes (corrupt PDF, unreadable workbook).
 */
public class ContentDecodingException extends DocumentProcessingException {

    public ContentDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
