package com.ledgerly.backend.services.documents.extraction;

import java.util.regex.Pattern;

/**
 * Deriva o nome do estabelecimento a partir da descrição da transação.
 */
public final class MerchantExtractor {

    private static final int MAX_LENGTH = 100;

    private static final Pattern OPERATION_PREFIX = Pattern.compile(
            "^(compra|pago|transferencia|d[eé]bito|cr[eé]dito)\\s+", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern INSTALLMENT = Pattern.compile("cuota \\d+ de \\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern REVERSAL = Pattern.compile("reverso\\s*-?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_DASH = Pattern.compile("^-\\s*");
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\s+-\\s+");

    private MerchantExtractor() {}

    public static String extract(String description) {
        if (description == null || description.isBlank()) return null;

        String merchant = description.trim();
        merchant = OPERATION_PREFIX.matcher(merchant).replaceFirst("");
        merchant = INSTALLMENT.matcher(merchant).replaceAll("");
        merchant = REVERSAL.matcher(merchant).replaceAll("");
        merchant = LEADING_DASH.matcher(merchant.trim()).replaceFirst("").trim();

        String[] parts = SEGMENT_SEPARATOR.split(merchant);
        if (parts.length > 0 && !parts[0].isBlank()) {
            merchant = parts[0];
        }

        if (merchant.length() > MAX_LENGTH) {
            merchant = merchant.substring(0, MAX_LENGTH);
        }
        merchant = merchant.trim();
        return merchant.isEmpty() ? null : merchant;
    }
}
