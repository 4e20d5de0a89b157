package com.ledgerly.backend.services.documents.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ledgerly.backend.enums.ExtractionMethod;
import com.ledgerly.backend.enums.TransactionType;
import com.ledgerly.backend.services.documents.model.DocumentClassification;
import com.ledgerly.backend.services.documents.model.ExtractionResult;
import com.ledgerly.backend.services.documents.model.ParsedContent;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;
import com.ledgerly.backend.services.documents.quality.PipelineConfidenceEvaluator;

class ExtractionEngineTest {

    private ExtractionEngine engine;
    private ExtractionProfileSelector selector;

    @BeforeEach
    void setUp() {
        selector = new ExtractionProfileSelector();
        engine = new ExtractionEngine(selector, new TabularExtractor(), new LineExtractor(),
                new PipelineConfidenceEvaluator());
    }

    @Test
    void hipotecarioDebitColumnYieldsNegativeAmount() {
        ParsedContent content = new ParsedContent("", List.of(
                row("FECHA", "15/01/2024", "DESCRIPCION", "NETFLIX SUSCRIPCION", "DEBITO EN $", "1.234,56")));

        ExtractionResult result = engine.extract(content, unknown(), "movimientos.csv");

        assertEquals("hipotecario-csv", result.profileId());
        assertEquals("Banco Hipotecario", result.bankNameGuess());
        assertEquals(ExtractionMethod.DETERMINISTIC, result.method());
        assertEquals(1, result.candidates().size());

        TransactionCandidate tx = result.candidates().get(0);
        assertEquals(LocalDate.of(2024, 1, 15), tx.getDate());
        assertEquals(new BigDecimal("-1234.56"), tx.getAmount());
        assertEquals(TransactionType.DEBIT, tx.getType());
        assertEquals("ARS", tx.getCurrency());
        assertEquals(ExtractionProfiles.TABULAR_BANK_CONFIDENCE, tx.getExtractionConfidence(), 0.001);
        assertEquals("NETFLIX SUSCRIPCION", tx.getRawSource().get("DESCRIPCION"));
        // 50 + 2 + 10 + 10 + 10
        assertEquals(82, result.pipelineConfidence());
    }

    @Test
    void hipotecarioDropsSummaryAndUnparseableRows() {
        List<Map<String, String>> rows = List.of(
                hipotecario("15/01/2024", "NETFLIX", "REF1", "1.234,56", ""),
                hipotecario("16/01/2024", "Acreditación haberes", "REF2", "", "500.000,00"),
                hipotecario("01/15/2024", "Fecha invertida", "REF3", "10,00", ""),
                hipotecario("TOTAL", "", "", "1.244,56", "500.000,00"),
                hipotecario("17/01/2024", "Sin importe", "REF4", "", ""));

        ExtractionResult result = engine.extract(new ParsedContent("", rows), unknown(), "hipo.csv");

        assertEquals(2, result.candidates().size());
        assertEquals(3, result.skippedRows());
        assertEquals(new BigDecimal("500000.00"), result.candidates().get(1).getAmount());
        assertEquals(TransactionType.CREDIT, result.candidates().get(1).getType());
        assertEquals("REF2", result.candidates().get(1).getReferenceNumber());
        assertEquals(LocalDate.of(2024, 1, 15), result.statementDate());
    }

    @Test
    void santanderSignedAmountWithBalance() {
        Map<String, String> r = new LinkedHashMap<>();
        r.put("Fecha", "02/01/2024");
        r.put("Suc. Origen", "001");
        r.put("Desc. Sucursal", "Casa Central");
        r.put("Cod. Operativo", "4512");
        r.put("Referencia", "");
        r.put("Concepto", "Pago de servicios EDENOR");
        r.put("Importe Pesos", "-15.230,00");
        r.put("Saldo Pesos", "120.000,50");

        ExtractionResult result = engine.extract(new ParsedContent("", List.of(r)), unknown(), "santander.csv");

        assertEquals("santander-csv", result.profileId());
        TransactionCandidate tx = result.candidates().get(0);
        assertEquals(new BigDecimal("-15230.00"), tx.getAmount());
        assertEquals(new BigDecimal("120000.50"), tx.getBalance());
        assertEquals("4512", tx.getReferenceNumber());
        assertEquals("Pago de servicios EDENOR", tx.getDescription());
    }

    @Test
    void unknownColumnsFallBackToSynonymMatching() {
        ParsedContent content = new ParsedContent("", List.of(
                row("date", "2024-01-05", "description", "Coffee shop", "amount", "-3.50", "reference", "R-1"),
                row("date", "2024-01-06", "description", "Salary", "amount", "1,500.00", "reference", "")));

        ExtractionResult result = engine.extract(content, unknown(), "export.csv");

        assertSame(ExtractionProfiles.GENERIC_COLUMNS, selector.select(content, unknown()));
        assertNull(result.bankNameGuess());
        assertEquals(2, result.candidates().size());
        assertEquals(new BigDecimal("-3.50"), result.candidates().get(0).getAmount());
        assertEquals("R-1", result.candidates().get(0).getReferenceNumber());
        assertEquals(new BigDecimal("1500.00"), result.candidates().get(1).getAmount());
        assertNull(result.candidates().get(1).getReferenceNumber());
        assertEquals(ExtractionProfiles.GENERIC_COLUMNS_CONFIDENCE, result.candidates().get(0).getExtractionConfidence(), 0.001);
    }

    @Test
    void dollarColumnMarksCurrency() {
        ParsedContent content = new ParsedContent("", List.of(
                row("Fecha", "10/01/2024", "Detalle", "Amazon", "Importe U$S", "-25,99")));

        ExtractionResult result = engine.extract(content, unknown(), "usd.csv");

        assertEquals("USD", result.candidates().get(0).getCurrency());
    }

    @Test
    void brubankLinesIncludingReversal() {
        String text = """
                Brubank
                Estado de Cuenta del 31/01/2024
                15/01/2024 100234 Compra NETFLIX -1.234,56
                16/01/2024 100235 Transferencia recibida 50.000,00
                17/01/2024 100236 Reverso - MERCADOLIBRE 2.500,00
                """;

        ExtractionResult result = engine.extract(ParsedContent.textOnly(text), bank("brubank", "Brubank"), "brubank.pdf");

        assertEquals("brubank-lines", result.profileId());
        assertEquals(LocalDate.of(2024, 1, 31), result.statementDate());
        assertEquals(3, result.candidates().size());

        TransactionCandidate reversal = result.candidates().get(2);
        assertEquals(new BigDecimal("-2500.00"), reversal.getAmount());
        assertEquals("Reverso - MERCADOLIBRE", reversal.getDescription());
        assertEquals("100236", reversal.getReferenceNumber());

        assertEquals(new BigDecimal("50000.00"), result.candidates().get(1).getAmount());
        assertEquals(ExtractionProfiles.LINE_CONFIDENCE, reversal.getExtractionConfidence(), 0.001);
        assertEquals(86, result.pipelineConfidence());
    }

    @Test
    void genericLinesUseDateAndLastAmountToken() {
        String text = """
                Movimientos
                05/02/2024 Pago tarjeta visa $ 12.500,00
                06/02/2024 ab 10,00
                31/02/2024 Compra invalida 100,00
                linea sin fecha alguna 100,00
                """;

        ExtractionResult result = engine.extract(ParsedContent.textOnly(text), unknown(), "otro.pdf");

        assertEquals("generic-lines", result.profileId());
        assertEquals(1, result.candidates().size());
        assertEquals(2, result.skippedRows());
        TransactionCandidate tx = result.candidates().get(0);
        assertEquals("Pago tarjeta visa", tx.getDescription());
        assertEquals(new BigDecimal("12500.00"), tx.getAmount());
        assertEquals(LocalDate.of(2024, 2, 5), tx.getDate());
    }

    @Test
    void unresolvableColumnsYieldEmptyResultWithZeroConfidence() {
        ParsedContent content = new ParsedContent("", List.of(row("foo", "1", "bar", "2")));

        ExtractionResult result = engine.extract(content, unknown(), "raro.csv");

        assertTrue(result.isEmpty());
        assertEquals(0, result.pipelineConfidence());
        assertEquals(1, result.skippedRows());
    }

    @Test
    void lineProfileFollowsClassifiedBank() {
        assertSame(ExtractionProfiles.SANTANDER_LINES,
                selector.select(ParsedContent.textOnly("x"), bank("santander", "Santander")));
        assertSame(ExtractionProfiles.GENERIC_LINES,
                selector.select(ParsedContent.textOnly("x"), bank("galicia", "Banco Galicia")));
    }

    @Test
    void signAlwaysMatchesType() {
        List<Map<String, String>> rows = List.of(
                hipotecario("15/01/2024", "A", "1", "100,00", ""),
                hipotecario("16/01/2024", "B", "2", "", "200,00"));

        for (TransactionCandidate tx : engine.extract(new ParsedContent("", rows), unknown(), "x.csv").candidates()) {
            assertEquals(tx.getAmount().signum() < 0, tx.getType() == TransactionType.DEBIT);
        }
    }

    @Test
    void genericLinesReadParenthesesAndTrailingMinusAsDebits() {
        String text = """
                15/01/2024 NETFLIX SUSCRIPCION (1.234,56)
                16/01/2024 SPOTIFY PREMIUM 899,00-
                17/01/2024 DEVOLUCION COMPRA 300,00
                """;

        ExtractionResult result = engine.extractWith(ExtractionProfiles.GENERIC_LINES,
                ParsedContent.textOnly(text), "otro.pdf");

        assertEquals(3, result.candidates().size());
        assertEquals(new BigDecimal("-1234.56"), result.candidates().get(0).getAmount());
        assertEquals("NETFLIX SUSCRIPCION", result.candidates().get(0).getDescription());
        assertEquals(new BigDecimal("-899.00"), result.candidates().get(1).getAmount());
        assertEquals(TransactionType.DEBIT, result.candidates().get(1).getType());
        assertEquals(new BigDecimal("300.00"), result.candidates().get(2).getAmount());
    }

    @Test
    void bankLinePatternsReadParenthesesAndTrailingMinusAsDebits() {
        String brubank = """
                15/01/2024 100234 Compra NETFLIX (1.234,56)
                16/01/2024 100235 Compra SPOTIFY 899,00-
                """;
        String santander = "20/01/2024 Pago EDENOR ($ 15.230,00)";

        ExtractionResult bru = engine.extractWith(ExtractionProfiles.BRUBANK_LINES,
                ParsedContent.textOnly(brubank), "brubank.pdf");
        ExtractionResult san = engine.extractWith(ExtractionProfiles.SANTANDER_LINES,
                ParsedContent.textOnly(santander), "santander.pdf");

        assertEquals(2, bru.candidates().size());
        assertEquals(new BigDecimal("-1234.56"), bru.candidates().get(0).getAmount());
        assertEquals("Compra NETFLIX", bru.candidates().get(0).getDescription());
        assertEquals(new BigDecimal("-899.00"), bru.candidates().get(1).getAmount());
        assertEquals(1, san.candidates().size());
        assertEquals(new BigDecimal("-15230.00"), san.candidates().get(0).getAmount());
    }

    private static Map<String, String> hipotecario(String fecha, String descripcion, String referencia,
                                                   String debito, String credito) {
        return row("FECHA", fecha, "DESCRIPCION", descripcion, "REFERENCIA", referencia,
                "DEBITO EN $", debito, "CREDITO EN $", credito);
    }

    private static Map<String, String> row(String... keyValues) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put(keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static DocumentClassification unknown() {
        return new DocumentClassification(DocumentClassification.UNKNOWN, "Documento", 0, Set.of(),
                DocumentClassification.UNKNOWN, DocumentClassification.UNKNOWN_BANK_NAME, 0);
    }

    private static DocumentClassification bank(String id, String name) {
        return new DocumentClassification("bank_statement", "Extracto Bancario", 74, Set.of(), id, name, 100);
    }
}
