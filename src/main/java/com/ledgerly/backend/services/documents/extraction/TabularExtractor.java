package com.ledgerly.backend.services.documents.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.services.documents.model.TransactionCandidate;
import com.ledgerly.backend.services.documents.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Extrai transações de linhas tabulares (CSV/planilha) segundo um perfil tabular.
 */
@Component
@Slf4j
public class TabularExtractor {

    static final String NO_DESCRIPTION = "Sin descripción";

    ProfileExtraction extract(List<Map<String, String>> rows, ExtractionProfile profile) {
        if (rows == null || rows.isEmpty()) return new ProfileExtraction(List.of(), 0, null);

        List<String> headers = new ArrayList<>(rows.get(0).keySet());
        Map<ColumnRole, String> columns = resolveColumns(headers, profile);
        log.debug("[Extractor] profile={} columns={}", profile.id(), columns);

        if (!columns.containsKey(ColumnRole.DATE) || !hasAmountColumns(columns, profile.kind())) {
            log.info("[Extractor] profile={} could not resolve date/amount columns from headers={}", profile.id(), headers);
            return new ProfileExtraction(List.of(), countNonBlank(rows), null);
        }

        String currency = currencyFor(columns, profile);
        List<TransactionCandidate> candidates = new ArrayList<>();
        int skipped = 0;

        for (Map<String, String> row : rows) {
            if (isBlank(row)) continue;

            TransactionCandidate candidate = toCandidate(row, columns, profile, currency);
            if (candidate == null) {
                skipped++;
                continue;
            }
            candidates.add(candidate);
        }

        if (skipped > 0) {
            log.info("[Extractor] profile={} skipped {} row(s)", profile.id(), skipped);
        }

        // Perfis de banco usam a data da primeira transação como data do extrato.
        LocalDate statementDate = profile.bankId() != null && !candidates.isEmpty() ? candidates.get(0).getDate() : null;
        return new ProfileExtraction(candidates, skipped, statementDate);
    }

    private TransactionCandidate toCandidate(Map<String, String> row, Map<ColumnRole, String> columns,
                                             ExtractionProfile profile, String currency) {
        String dateValue = cell(row, columns.get(ColumnRole.DATE));
        if (dateValue == null || isSummaryRow(dateValue)) {
            log.debug("[Extractor] Skipping row without date or summary row: {}", row);
            return null;
        }

        LocalDate date = StatementDateParser.parse(dateValue, profile.dateLayouts());
        if (date == null) {
            log.debug("[Extractor] Skipping row with unparseable date '{}'", dateValue);
            return null;
        }

        BigDecimal amount = resolveAmount(row, columns, profile.kind());
        if (amount == null || amount.signum() == 0) {
            log.debug("[Extractor] Skipping row without amount: {}", row);
            return null;
        }

        String description = firstNonBlank(
                cell(row, columns.get(ColumnRole.DESCRIPTION)),
                cell(row, columns.get(ColumnRole.BRANCH_DESCRIPTION)));
        if (description == null) description = NO_DESCRIPTION;

        String reference = firstNonBlank(
                cell(row, columns.get(ColumnRole.REFERENCE)),
                cell(row, columns.get(ColumnRole.OPERATION_CODE)));

        String balanceValue = cell(row, columns.get(ColumnRole.BALANCE));
        BigDecimal balance = balanceValue != null ? AmountParser.parse(balanceValue) : null;

        return TransactionCandidate.builder()
                .date(date)
                .description(description)
                .merchant(MerchantExtractor.extract(description))
                .amount(amount.setScale(2, RoundingMode.HALF_UP))
                .referenceNumber(reference)
                .balance(balance != null ? balance.setScale(2, RoundingMode.HALF_UP) : null)
                .rawSource(new LinkedHashMap<>(row))
                .extractionConfidence(profile.candidateConfidence())
                .currency(currency)
                .build();
    }

    private static BigDecimal resolveAmount(Map<String, String> row, Map<ColumnRole, String> columns, ProfileKind kind) {
        if (kind == ProfileKind.SPLIT_DEBIT_CREDIT) {
            BigDecimal credit = AmountParser.parse(cell(row, columns.get(ColumnRole.CREDIT)));
            BigDecimal debit = AmountParser.parse(cell(row, columns.get(ColumnRole.DEBIT)));
            if (credit != null && credit.signum() != 0) return credit.abs();
            if (debit != null && debit.signum() != 0) return debit.abs().negate();
            return null;
        }
        return AmountParser.parse(cell(row, columns.get(ColumnRole.AMOUNT)));
    }

    private static Map<ColumnRole, String> resolveColumns(List<String> headers, ExtractionProfile profile) {
        Map<ColumnRole, String> columns = new EnumMap<>(ColumnRole.class);
        for (ColumnRule rule : profile.columnRules()) {
            String header = rule.resolve(headers);
            if (header != null) columns.put(rule.role(), header);
        }
        return columns;
    }

    private static boolean hasAmountColumns(Map<ColumnRole, String> columns, ProfileKind kind) {
        if (kind == ProfileKind.SPLIT_DEBIT_CREDIT) {
            return columns.containsKey(ColumnRole.DEBIT) || columns.containsKey(ColumnRole.CREDIT);
        }
        return columns.containsKey(ColumnRole.AMOUNT);
    }

    /**
     * Coluna de valor em dólar ("U$S", "USD", "Dólares") indica USD; senão a moeda do perfil.
     */
    private static String currencyFor(Map<ColumnRole, String> columns, ExtractionProfile profile) {
        List<String> amountHeaders = new ArrayList<>();
        for (ColumnRole role : List.of(ColumnRole.AMOUNT, ColumnRole.DEBIT, ColumnRole.CREDIT)) {
            if (columns.containsKey(role)) amountHeaders.add(columns.get(role));
        }
        for (String header : amountHeaders) {
            String upper = header.toUpperCase(Locale.ROOT);
            if (upper.contains("U$S") || upper.contains("USD") || NormalizeUtil.normalizeHeader(header).contains("DOLAR")) {
                return "USD";
            }
        }
        return profile.defaultCurrency();
    }

    private static boolean isSummaryRow(String dateValue) {
        String lower = dateValue.toLowerCase(Locale.ROOT);
        return lower.contains("total") || lower.contains("presente documento");
    }

    private static String cell(Map<String, String> row, String header) {
        if (header == null) return null;
        return NormalizeUtil.blankToNull(row.get(header));
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    private static boolean isBlank(Map<String, String> row) {
        return row.values().stream().allMatch(v -> v == null || v.isBlank());
    }

    private static int countNonBlank(List<Map<String, String>> rows) {
        int n = 0;
        for (Map<String, String> row : rows) {
            if (!isBlank(row)) n++;
        }
        return n;
    }
}
