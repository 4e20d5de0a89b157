package com.ledgerly.backend.services.documents.extraction;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Catálogo de perfis de extração. A ordem das listas é a ordem de tentativa.
 * As confianças por transação (90/85/75) são calibração e devem ser preservadas.
 */
public final class ExtractionProfiles {

    public static final String VERSION = "2024.1";

    public static final double TABULAR_BANK_CONFIDENCE = 90.0;
    public static final double GENERIC_COLUMNS_CONFIDENCE = 85.0;
    public static final double LINE_CONFIDENCE = 75.0;

    private static final String ARS = "ARS";
    private static final int CI = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // Valor no fim da linha: "(1.234,56)" e "1.234,56-" são negativos.
    private static final String LINE_AMOUNT = "(\\(\\s*-?\\$?\\s*\\d[\\d.,]*\\s*\\)|-?\\$?\\s*\\d[\\d.,]*-?)";

    private static final String GENERIC_NUMBER = "(?:\\d{1,3}(?:[.,]\\d{3})+|\\d+)[.,]\\d{2}(?!\\d)";

    private static final List<DateLayout> TABULAR_DATES = List.of(
            DateLayout.ISO_DATE,
            DateLayout.ISO_DATE_TIME,
            DateLayout.DAY_MONTH_YEAR_SLASH,
            DateLayout.DAY_MONTH_YEAR_DASH,
            DateLayout.SPREADSHEET_SERIAL);

    private static final List<DateLayout> LINE_DATES = List.of(
            DateLayout.DAY_MONTH_YEAR_SLASH,
            DateLayout.DAY_MONTH_YEAR_DASH,
            DateLayout.DAY_MONTH_SHORT_YEAR_SLASH,
            DateLayout.ISO_DATE);

    // FECHA, DESCRIPCION, SUCURSAL, REFERENCIA, DEBITO EN $, CREDITO EN $, SALDO EN $
    public static final ExtractionProfile HIPOTECARIO_CSV = tabular(
            "hipotecario-csv", ProfileKind.SPLIT_DEBIT_CREDIT, "hipotecario", "Banco Hipotecario",
            TabularSignature.allOf(List.of(List.of("DEBITO EN", "CREDITO EN"))),
            List.of(
                    ColumnRule.exact(ColumnRole.DATE, "FECHA"),
                    ColumnRule.exact(ColumnRole.DESCRIPTION, "DESCRIPCION"),
                    ColumnRule.exact(ColumnRole.REFERENCE, "REFERENCIA"),
                    ColumnRule.contains(ColumnRole.DEBIT, "DEBITO"),
                    ColumnRule.contains(ColumnRole.CREDIT, "CREDITO"),
                    ColumnRule.contains(ColumnRole.BALANCE, "SALDO")),
            TABULAR_BANK_CONFIDENCE);

    // Fecha, Suc. Origen, Desc. Sucursal, Cod. Operativo, Referencia, Concepto, Importe Pesos, Saldo Pesos
    public static final ExtractionProfile SANTANDER_CSV = tabular(
            "santander-csv", ProfileKind.SIGNED_AMOUNT_WITH_BALANCE, "santander", "Banco Santander",
            TabularSignature.allOf(List.of(
                    List.of("IMPORTE"),
                    List.of("SALDO"),
                    List.of("CONCEPTO", "COD OPERATIVO"))),
            List.of(
                    ColumnRule.exact(ColumnRole.DATE, "FECHA"),
                    ColumnRule.exact(ColumnRole.DESCRIPTION, "CONCEPTO"),
                    ColumnRule.contains(ColumnRole.BRANCH_DESCRIPTION, "DESC SUCURSAL"),
                    ColumnRule.exact(ColumnRole.REFERENCE, "REFERENCIA"),
                    ColumnRule.contains(ColumnRole.OPERATION_CODE, "COD OPERATIVO"),
                    ColumnRule.of(ColumnRole.AMOUNT, List.of("IMPORTE"), List.of("IMPORTE PESOS")),
                    ColumnRule.of(ColumnRole.BALANCE, List.of("SALDO"), List.of("SALDO PESOS"))),
            TABULAR_BANK_CONFIDENCE);

    public static final ExtractionProfile GENERIC_COLUMNS = tabular(
            "generic-columns", ProfileKind.GENERIC_COLUMNS, null, null,
            null,
            List.of(
                    ColumnRule.contains(ColumnRole.DATE, "FECHA", "DATE"),
                    ColumnRule.contains(ColumnRole.DESCRIPTION,
                            "DESCRIPCION", "DESCRIPTION", "MERCHANT", "COMERCIO", "DETALLE", "CONCEPTO"),
                    ColumnRule.contains(ColumnRole.AMOUNT, "MONTO", "AMOUNT", "IMPORTE", "PESOS", "VALOR", "TOTAL"),
                    ColumnRule.contains(ColumnRole.REFERENCE, "REFERENCIA", "REFERENCE", "REF", "NUMERO"),
                    ColumnRule.contains(ColumnRole.BALANCE, "SALDO", "BALANCE")),
            GENERIC_COLUMNS_CONFIDENCE);

    public static final ExtractionProfile BRUBANK_LINES = new ExtractionProfile(
            "brubank-lines", VERSION, ProfileKind.LINE_PATTERN, "brubank", "Brubank",
            null, List.of(),
            List.of(
                    // Reversos vêm antes: sempre débito, qualquer que seja o sinal impresso.
                    new LinePattern("brubank-reversal",
                            Pattern.compile("^(\\d{2}/\\d{2}/\\d{4})\\s+(\\d+)\\s+Reverso\\s*-?\\s*(.+?)\\s+" + LINE_AMOUNT + "\\s*$", CI),
                            1, 2, 3, 4, true, "Reverso - "),
                    new LinePattern("brubank-movement",
                            Pattern.compile("^(\\d{2}/\\d{2}/\\d{4})\\s+(\\d+)\\s+(.+?)\\s+" + LINE_AMOUNT + "\\s*$"),
                            1, 2, 3, 4, false, "")),
            List.of(), 10, 1,
            null, null,
            Pattern.compile("(?:Estado de Cuenta|Estado del)\\s+(?:del?\\s+)?(\\d{2}/\\d{2}/\\d{4})", CI),
            LINE_DATES, ARS, LINE_CONFIDENCE);

    public static final ExtractionProfile SANTANDER_LINES = new ExtractionProfile(
            "santander-lines", VERSION, ProfileKind.LINE_PATTERN, "santander", "Banco Santander",
            null, List.of(),
            List.of(new LinePattern("santander-movement",
                    Pattern.compile("^(\\d{2}/\\d{2}/\\d{2,4})\\s+(.+?)\\s+" + LINE_AMOUNT + "\\s*$"),
                    1, 0, 2, 3, false, "")),
            List.of("fecha", "período", "periodo", "desde", "hasta"), 10, 3,
            null, null,
            Pattern.compile("(?:Resumen|Estado)\\s+(?:del?\\s+)?(\\d{2}/\\d{2}/\\d{4})", CI),
            LINE_DATES, ARS, LINE_CONFIDENCE);

    public static final ExtractionProfile GENERIC_LINES = new ExtractionProfile(
            "generic-lines", VERSION, ProfileKind.GENERIC_LINE, null, null,
            null, List.of(), List.of(), List.of(), 15, 3,
            Pattern.compile("(?<![\\d/-])(\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4})(?![\\d/-])"),
            Pattern.compile("\\(\\s?-?\\$?\\s?" + GENERIC_NUMBER + "\\s?\\)|-?\\$?\\s?" + GENERIC_NUMBER + "-?"),
            null,
            LINE_DATES, ARS, LINE_CONFIDENCE);

    public static final List<ExtractionProfile> TABULAR = List.of(HIPOTECARIO_CSV, SANTANDER_CSV);
    public static final List<ExtractionProfile> LINE = List.of(BRUBANK_LINES, SANTANDER_LINES);

    private ExtractionProfiles() {}

    public static ExtractionProfile byId(String id) {
        for (ExtractionProfile profile : List.of(HIPOTECARIO_CSV, SANTANDER_CSV, GENERIC_COLUMNS,
                BRUBANK_LINES, SANTANDER_LINES, GENERIC_LINES)) {
            if (profile.id().equals(id)) return profile;
        }
        return null;
    }

    private static ExtractionProfile tabular(String id, ProfileKind kind, String bankId, String bankName,
                                             TabularSignature signature, List<ColumnRule> rules, double confidence) {
        return new ExtractionProfile(id, VERSION, kind, bankId, bankName, signature, rules,
                List.of(), List.of(), 0, 0, null, null, null, TABULAR_DATES, ARS, confidence);
    }
}
