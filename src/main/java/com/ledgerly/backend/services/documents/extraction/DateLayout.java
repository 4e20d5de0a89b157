package com.ledgerly.backend.services.documents.extraction;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Formatos de data aceitos. Só ordens explícitas e declaradas: nunca mês/dia.
 */
public enum DateLayout {
    ISO_DATE("\\d{4}-\\d{1,2}-\\d{1,2}", "uuuu-M-d"),
    ISO_DATE_TIME("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}.*", null),
    DAY_MONTH_YEAR_SLASH("\\d{1,2}/\\d{1,2}/\\d{4}", "d/M/uuuu"),
    DAY_MONTH_YEAR_DASH("\\d{1,2}-\\d{1,2}-\\d{4}", "d-M-uuuu"),
    DAY_MONTH_SHORT_YEAR_SLASH("\\d{1,2}/\\d{1,2}/\\d{2}", "d/M/uu"),
    SPREADSHEET_SERIAL("\\d{5}(?:\\.0+)?", null);

    // Serial de planilha: dias desde 1899-12-30 (25569 = 1970-01-01).
    private static final LocalDate SERIAL_EPOCH = LocalDate.of(1899, 12, 30);
    private static final int MIN_SERIAL = 25569;
    private static final int MAX_SERIAL = 99999;

    private final Pattern shape;
    private final DateTimeFormatter formatter;

    DateLayout(String shape, String pattern) {
        this.shape = Pattern.compile(shape);
        this.formatter = pattern == null ? null
                : DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * @return a data, ou null quando o token não tem este formato ou não é uma data válida
     */
    public LocalDate parse(String token) {
        if (token == null) return null;
        String value = token.trim();
        if (!shape.matcher(value).matches()) return null;

        try {
            return switch (this) {
                case ISO_DATE_TIME -> LocalDate.parse(value.substring(0, 10));
                case SPREADSHEET_SERIAL -> fromSerial(value);
                default -> LocalDate.parse(value, formatter);
            };
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static LocalDate fromSerial(String value) {
        int dot = value.indexOf('.');
        int serial = Integer.parseInt(dot >= 0 ? value.substring(0, dot) : value);
        if (serial <= MIN_SERIAL || serial > MAX_SERIAL) return null;
        return SERIAL_EPOCH.plusDays(serial);
    }
}
