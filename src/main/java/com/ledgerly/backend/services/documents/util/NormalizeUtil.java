package com.ledgerly.backend.services.documents.util;

import java.text.Normalizer;
import java.util.Locale;

public class NormalizeUtil {

    private NormalizeUtil() {}

    /**
     * Normaliza texto: lowercase, remove acentos, colapsa espaços
     * Exemplo: "Banco de la Nación" => "banco de la nacion"
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";

        String result = text.toLowerCase(Locale.ROOT);
        result = stripAccents(result);

        // PDFBox costuma trazer NBSP e outros separadores que não casam com \s.
        result = result.replace('\u00A0', ' ');
        result = result.replaceAll("\\p{Z}+", " ");

        return result.replaceAll("\\s+", " ").trim();
    }

    /**
     * Forma canônica de um cabeçalho de coluna: maiúsculas, sem acentos, pontuação vira espaço.
     * Exemplo: "Débito en $" => "DEBITO EN", "Cod. Operativo" => "COD OPERATIVO"
     */
    public static String normalizeHeader(String header) {
        if (header == null || header.isBlank()) return "";
        String result = stripAccents(header.toUpperCase(Locale.ROOT));
        result = result.replaceAll("[^A-Z0-9]+", " ");
        return result.trim();
    }

    public static String stripAccents(String text) {
        if (text == null) return "";
        String result = Normalizer.normalize(text, Normalizer.Form.NFD);
        return result.replaceAll("\\p{M}", "");
    }

    public static String blankToNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }
}
