package com.ledgerly.backend.services.documents.model;

import java.util.List;
import java.util.Map;

/**
 * Conteúdo decodificado: texto sempre; linhas apenas para formatos tabulares.
 */
public record ParsedContent(String text, List<Map<String, String>> rows) {

    public ParsedContent {
        if (text == null) text = "";
        rows = rows == null ? null : List.copyOf(rows);
    }

    public static ParsedContent textOnly(String text) {
        return new ParsedContent(text, null);
    }

    public boolean hasRows() {
        return rows != null && !rows.isEmpty();
    }

    public boolean hasText() {
        return !text.isBlank();
    }

    public List<String> headers() {
        if (!hasRows()) return List.of();
        return List.copyOf(rows.get(0).keySet());
    }
}
