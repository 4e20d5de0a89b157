package com.ledgerly.backend.services.documents.model;

import java.util.UUID;

/**
 * Arquivo enviado por um usuário, ainda não interpretado.
 */
public record SourceDocument(
        UUID id,
        UUID ownerId,
        String mediaType,
        String originalName,
        byte[] content
) {

    public SourceDocument {
        if (id == null) id = UUID.randomUUID();
        if (content == null) content = new byte[0];
    }

    public static SourceDocument of(UUID ownerId, String originalName, String mediaType, byte[] content) {
        return new SourceDocument(UUID.randomUUID(), ownerId, mediaType, originalName, content);
    }
}
