package com.ledgerly.backend.services.documents.parsing;

import com.ledgerly.backend.services.documents.DocumentProcessingException;

/**
 * Thrown when neither the media type nor the file extension maps to a known decoder.
 */
public class UnsupportedFormatException extends DocumentProcessingException {

    public UnsupportedFormatException(String mediaType, String fileName) {
        super("Unsupported file format: mediaType=" + mediaType + " fileName=" + fileName);
    }
}
