package com.ledgerly.backend.services.documents.escalation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerly.backend.config.AiExtractionProperties;
import com.ledgerly.backend.enums.ExtractionMethod;
import com.ledgerly.backend.services.documents.extraction.DateLayout;
import com.ledgerly.backend.services.documents.extraction.MerchantExtractor;
import com.ledgerly.backend.services.documents.extraction.StatementDateParser;
import com.ledgerly.backend.services.documents.model.ExtractionResult;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;
import com.ledgerly.backend.services.documents.util.NormalizeUtil;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.responses.Response;
import com.openai.models.responses.ResponseCreateParams;
import com.openai.models.responses.ResponseOutputItem;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Extração de transações via OpenAI (Responses API). Pedimos JSON puro e fazemos o parse aqui.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiEnhancedExtractionClient implements EnhancedExtractionClient {

    static final double AI_CONFIDENCE = 95.0;
    static final String AI_PROFILE_ID = "openai-responses";

    private static final List<DateLayout> AI_DATES = List.of(
            DateLayout.ISO_DATE,
            DateLayout.ISO_DATE_TIME,
            DateLayout.DAY_MONTH_YEAR_SLASH);

    private final AiExtractionProperties properties;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private volatile OpenAIClient client;

    @Override
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    @Override
    public ExtractionResult extract(String text, String fileName) throws EnhancedExtractionException {
        String content = text == null ? "" : text.trim();
        if (content.isEmpty()) {
            throw new EnhancedExtractionException("No text available for AI extraction");
        }
        if (!isAvailable()) {
            throw new EnhancedExtractionException("AI extraction is not configured");
        }

        OpenAIClient c = getOrCreateClient(properties.getApiKey().trim());
        String prompt = buildPrompt(content, fileName);
        log.info("[OpenAI] Starting extraction file={} textLen={} model={}", fileName, content.length(), properties.getModel());

        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long start = System.currentTimeMillis();
            try {
                ResponseCreateParams params = ResponseCreateParams.builder()
                        .model(properties.getModel())
                        .input(prompt)
                        .maxOutputTokens(properties.getMaxTokens())
                        .temperature(properties.getTemperature())
                        .build();

                Response response = c.responses().create(params);
                String output = extractOutputText(response);
                long elapsed = System.currentTimeMillis() - start;

                if (output.isBlank()) {
                    throw new EnhancedExtractionException("Empty response from model (elapsedMs=" + elapsed + ")");
                }

                ExtractionResult result = parseResponse(output);
                log.info("[OpenAI] Extraction succeeded: {} transactions (attempt={} elapsedMs={})",
                        result.candidates().size(), attempt, elapsed);
                return result;
            } catch (Exception e) {
                lastError = e;
                long elapsed = System.currentTimeMillis() - start;
                log.warn("[OpenAI] Extraction error (attempt={} elapsedMs={}): {}", attempt, elapsed, e.toString());
                if (attempt < maxAttempts) sleepBackoff(attempt);
            }
        }

        throw new EnhancedExtractionException("AI extraction failed after " + maxAttempts + " attempt(s)", lastError);
    }

    private OpenAIClient getOrCreateClient(String key) {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            client = OpenAIOkHttpClient.builder()
                    .apiKey(key)
                    .timeout(Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds())))
                    .build();
            return client;
        }
    }

    static String buildPrompt(String text, String fileName) {
        return "Eres un experto en análisis de documentos financieros. Extrae las transacciones de este extracto.\n\n"
                + "ARCHIVO: " + (fileName == null ? "" : fileName) + "\n\n"
                + "INSTRUCCIONES:\n"
                + "1. Extrae TODAS las transacciones del documento\n"
                + "2. Para cada una: fecha (YYYY-MM-DD), referencia (o null), descripcion, dolares, pesos\n"
                + "3. Débitos y cargos son NEGATIVOS; créditos y acreditaciones son POSITIVOS\n"
                + "4. Los \"Reverso\" son siempre negativos\n"
                + "5. Si la transacción es en pesos, dolares = 0; si es en dólares, pesos = 0\n"
                + "6. Identifica el banco y la fecha del estado si aparecen\n\n"
                + "Responde SOLO con JSON válido, sin markdown:\n"
                + "{\n"
                + "  \"banco\": \"string o null\",\n"
                + "  \"fecha_estado\": \"YYYY-MM-DD o null\",\n"
                + "  \"movimientos\": [\n"
                + "    {\"fecha\": \"YYYY-MM-DD\", \"referencia\": \"string o null\", \"descripcion\": \"string\", \"dolares\": 0.00, \"pesos\": 0.00}\n"
                + "  ]\n"
                + "}\n\n"
                + "CONTENIDO:\n"
                + text;
    }

    /**
     * Converte a resposta JSON do modelo. Movimentos sem data válida ou sem valor são descartados.
     */
    ExtractionResult parseResponse(String raw) throws EnhancedExtractionException {
        AiStatementJson parsed;
        try {
            parsed = objectMapper.readValue(stripCodeFences(raw), AiStatementJson.class);
        } catch (Exception e) {
            throw new EnhancedExtractionException("Invalid JSON from model: " + e.getMessage(), e);
        }
        if (parsed == null || parsed.movimientos == null) {
            throw new EnhancedExtractionException("Invalid response format: missing movimientos array");
        }

        List<TransactionCandidate> candidates = new ArrayList<>();
        int skipped = 0;
        for (AiMovement mov : parsed.movimientos) {
            TransactionCandidate candidate = toCandidate(mov);
            if (candidate == null) {
                skipped++;
                continue;
            }
            candidates.add(candidate);
        }

        return new ExtractionResult(
                candidates,
                NormalizeUtil.blankToNull(parsed.banco),
                StatementDateParser.parse(parsed.fechaEstado, AI_DATES),
                candidates.isEmpty() ? 0 : (int) AI_CONFIDENCE,
                ExtractionMethod.AI_ASSISTED,
                AI_PROFILE_ID,
                skipped);
    }

    private static TransactionCandidate toCandidate(AiMovement mov) {
        if (mov == null) return null;
        LocalDate date = StatementDateParser.parse(mov.fecha, AI_DATES);
        if (date == null) return null;

        BigDecimal pesos = mov.pesos != null ? mov.pesos : BigDecimal.ZERO;
        BigDecimal dolares = mov.dolares != null ? mov.dolares : BigDecimal.ZERO;
        boolean inPesos = pesos.signum() != 0;
        BigDecimal amount = inPesos ? pesos : dolares;
        if (amount.signum() == 0) return null;

        String description = NormalizeUtil.blankToNull(mov.descripcion);
        if (description == null) description = "Sin descripción";

        Map<String, String> rawSource = new LinkedHashMap<>();
        rawSource.put("fecha", mov.fecha);
        rawSource.put("referencia", mov.referencia);
        rawSource.put("descripcion", mov.descripcion);
        rawSource.put("pesos", pesos.toPlainString());
        rawSource.put("dolares", dolares.toPlainString());

        return TransactionCandidate.builder()
                .date(date)
                .description(description)
                .merchant(MerchantExtractor.extract(description))
                .amount(amount.setScale(2, RoundingMode.HALF_UP))
                .referenceNumber(NormalizeUtil.blankToNull(mov.referencia))
                .rawSource(rawSource)
                .extractionConfidence(AI_CONFIDENCE)
                .currency(inPesos ? "ARS" : "USD")
                .processedByAi(true)
                .build();
    }

    private static String extractOutputText(Response response) {
        if (response == null) return "";
        StringBuilder sb = new StringBuilder();
        List<ResponseOutputItem> output = response.output();
        if (output == null || output.isEmpty()) return "";

        for (ResponseOutputItem item : output) {
            if (item == null) continue;
            item.message().ifPresent(message -> {
                if (message.content() == null) return;
                for (var content : message.content()) {
                    if (content == null) continue;
                    content.outputText().ifPresent(t -> {
                        String v = t.text();
                        if (v != null && !v.isBlank()) {
                            if (!sb.isEmpty()) sb.append('\n');
                            sb.append(v);
                        }
                    });
                }
            });
        }
        return sb.toString();
    }

    static String stripCodeFences(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            if (firstNewline >= 0) {
                s = s.substring(firstNewline + 1);
            }
            int lastFence = s.lastIndexOf("```");
            if (lastFence >= 0) {
                s = s.substring(0, lastFence);
            }
        }
        return s.trim();
    }

    private static void sleepBackoff(int attempt) {
        long ms = switch (attempt) {
            case 1 -> 400;
            case 2 -> 1200;
            default -> 2800;
        };
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class AiStatementJson {
        public String banco;
        @JsonProperty("fecha_estado")
        public String fechaEstado;
        public List<AiMovement> movimientos;
    }

    private static final class AiMovement {
        public String fecha;
        public String referencia;
        public String descripcion;
        public BigDecimal dolares;
        public BigDecimal pesos;
    }
}
