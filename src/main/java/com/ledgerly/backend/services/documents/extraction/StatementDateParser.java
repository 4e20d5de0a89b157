package com.ledgerly.backend.services.documents.extraction;

import java.time.LocalDate;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class StatementDateParser {

    private StatementDateParser() {}

    /**
     * Tenta os formatos na ordem declarada; o primeiro que reconhecer o token vence.
     */
    public static LocalDate parse(String token, List<DateLayout> layouts) {
        if (token == null || token.isBlank() || layouts == null) return null;
        for (DateLayout layout : layouts) {
            LocalDate date = layout.parse(token);
            if (date != null) return date;
        }
        return null;
    }

    /**
     * Procura a data de emissão no texto; o grupo 1 do padrão deve capturar a data.
     */
    public static LocalDate find(String text, Pattern pattern, List<DateLayout> layouts) {
        if (text == null || pattern == null) return null;
        Matcher m = pattern.matcher(text);
        if (!m.find()) return null;
        return parse(m.group(1), layouts);
    }
}
