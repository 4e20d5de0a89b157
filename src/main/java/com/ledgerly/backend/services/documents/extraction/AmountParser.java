package com.ledgerly.backend.services.documents.extraction;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Converte tokens monetários de qualquer convenção regional em BigDecimal.
 *
 * Com '.' e ',' presentes, o separador que aparece por último é o decimal.
 * Com um só tipo de separador: repetido é agrupamento de milhar; uma ocorrência seguida de
 * exatamente 3 dígitos (e parte inteira diferente de zero) também; caso contrário é decimal.
 * Sinal '-' (antes ou depois) e parênteses indicam valor negativo.
 */
public final class AmountParser {

    private AmountParser() {}

    /**
     * @return o valor, ou null quando o token não é um número reconhecível
     */
    public static BigDecimal parse(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1);
        }

        s = s.toUpperCase(Locale.ROOT)
                .replace("U$S", "")
                .replace("USD", "")
                .replace("ARS", "")
                .replace("$", "")
                .replace('\u00A0', ' ')
                .replaceAll("\\s+", "");

        if (s.startsWith("-")) {
            negative = !negative;
            s = s.substring(1);
        } else if (s.endsWith("-")) {
            negative = !negative;
            s = s.substring(0, s.length() - 1);
        } else if (s.startsWith("+")) {
            s = s.substring(1);
        }

        if (s.isEmpty() || !s.matches("[0-9.,]+") || !s.matches(".*\\d.*")) return null;

        String normalized = normalizeSeparators(s);
        if (normalized == null || normalized.isEmpty() || normalized.equals(".")) return null;

        try {
            BigDecimal value = new BigDecimal(normalized);
            return negative ? value.negate() : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalizeSeparators(String s) {
        int lastDot = s.lastIndexOf('.');
        int lastComma = s.lastIndexOf(',');

        if (lastDot >= 0 && lastComma >= 0) {
            char decimal = lastDot > lastComma ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            if (count(s, decimal) > 1) return null;
            return s.replace(String.valueOf(grouping), "").replace(decimal, '.');
        }

        if (lastDot < 0 && lastComma < 0) return s;

        char sep = lastDot >= 0 ? '.' : ',';
        int first = s.indexOf(sep);
        int trailingDigits = s.length() - 1 - s.lastIndexOf(sep);

        if (count(s, sep) > 1) {
            return s.replace(String.valueOf(sep), "");
        }

        String integerPart = s.substring(0, first);
        boolean groupingLike = trailingDigits == 3 && !integerPart.isEmpty() && !integerPart.matches("0+");
        if (groupingLike) {
            return s.replace(String.valueOf(sep), "");
        }
        return s.replace(sep, '.');
    }

    private static int count(String s, char ch) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == ch) n++;
        }
        return n;
    }
}
