package com.ledgerly.backend.services.documents.parsing;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.config.PipelineProperties;
import com.ledgerly.backend.services.documents.model.ParsedContent;
import com.ledgerly.backend.services.documents.util.NormalizeUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Transforma os bytes de um documento em texto e, para formatos tabulares, em linhas
 * (mapas cabeçalho -> valor). A decodificação em si fica com PDFBox, OpenCSV e POI.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentParser {

    static final List<String> HEADER_KEYWORDS = List.of(
            "FECHA", "DATE",
            "IMPORTE", "MONTO", "AMOUNT",
            "SALDO", "BALANCE",
            "DESCRIPCION", "DESCRIPTION", "CONCEPTO", "DETALLE",
            "REFERENCIA", "REFERENCE",
            "DEBITO", "CREDITO", "DEBIT", "CREDIT");

    private static final Charset FALLBACK_CHARSET = Charset.forName("windows-1252");

    private final PdfTextExtractor pdfTextExtractor;
    private final DelimitedTextReader delimitedTextReader;
    private final SpreadsheetReader spreadsheetReader;
    private final PipelineProperties pipelineProperties;

    public ParsedContent parse(byte[] bytes, String mediaType, String fileName) {
        DocumentFormat format = resolveFormat(mediaType, fileName);
        byte[] content = bytes == null ? new byte[0] : bytes;

        try {
            ParsedContent parsed = switch (format) {
                case PDF -> ParsedContent.textOnly(pdfTextExtractor.extractText(content));
                case DELIMITED -> parseDelimited(content);
                case SPREADSHEET -> parseSpreadsheet(content);
            };
            log.info("[Parser] Parsed file={} format={} textLen={} rows={}",
                    fileName, format, parsed.text().length(), parsed.hasRows() ? parsed.rows().size() : 0);
            return parsed;
        } catch (IOException | RuntimeException e) {
            throw new ContentDecodingException("Failed to decode " + format + " file " + fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Linhas do documento, ou null quando o formato não é tabular (PDF).
     */
    public List<Map<String, String>> extractRows(byte[] bytes, String mediaType, String fileName) {
        DocumentFormat format = resolveFormat(mediaType, fileName);
        if (format == DocumentFormat.PDF) return null;
        return parse(bytes, mediaType, fileName).rows();
    }

    private DocumentFormat resolveFormat(String mediaType, String fileName) {
        DocumentFormat format = DocumentFormat.resolve(mediaType, fileName);
        if (format == null) {
            log.warn("[Parser] Unsupported format mediaType={} file={}", mediaType, fileName);
            throw new UnsupportedFormatException(mediaType, fileName);
        }
        return format;
    }

    private ParsedContent parseDelimited(byte[] bytes) throws IOException {
        String content = decodeText(bytes);
        char delimiter = detectDelimiter(content);
        List<List<String>> records = dropBlankRecords(delimitedTextReader.readRecords(content, delimiter));
        log.debug("[Parser] Delimited content delimiter='{}' records={}", printable(delimiter), records.size());

        if (records.isEmpty()) return new ParsedContent(content, List.of());
        return new ParsedContent(renderText(records), toRowMaps(records, 0));
    }

    private ParsedContent parseSpreadsheet(byte[] bytes) throws IOException {
        List<List<String>> records = dropBlankRecords(spreadsheetReader.readFirstSheet(bytes));
        if (records.isEmpty()) return new ParsedContent("", List.of());

        int headerIdx = locateHeaderRow(records);
        log.debug("[Parser] Spreadsheet header located at row {} of {}", headerIdx, records.size());
        // O texto inclui as linhas acima do cabeçalho (nome do banco, período), úteis na classificação.
        return new ParsedContent(renderText(records), toRowMaps(records, headerIdx));
    }

    /**
     * Primeira linha, entre as {@code headerScanRows} iniciais, com ao menos
     * {@code minHeaderKeywords} células que parecem nomes de coluna. Sem candidata, a linha 0.
     */
    int locateHeaderRow(List<List<String>> records) {
        int limit = Math.min(records.size(), Math.max(1, pipelineProperties.getHeaderScanRows()));
        for (int i = 0; i < limit; i++) {
            int hits = 0;
            for (String cell : records.get(i)) {
                String normalized = NormalizeUtil.normalizeHeader(cell);
                if (normalized.isEmpty()) continue;
                for (String keyword : HEADER_KEYWORDS) {
                    if (normalized.contains(keyword)) {
                        hits++;
                        break;
                    }
                }
            }
            if (hits >= pipelineProperties.getMinHeaderKeywords()) return i;
        }
        return 0;
    }

    /**
     * Conta vírgula, ponto-e-vírgula e tab (fora de aspas) na primeira linha não vazia.
     * Empate: ';' antes de tab antes de ','. Nenhum encontrado: ','.
     */
    static char detectDelimiter(String content) {
        if (content == null) return ',';
        String firstLine = "";
        for (String line : content.split("\\r?\\n")) {
            if (!line.isBlank()) {
                firstLine = line;
                break;
            }
        }

        int commas = 0;
        int semicolons = 0;
        int tabs = 0;
        boolean quoted = false;
        for (char ch : firstLine.toCharArray()) {
            if (ch == '"') {
                quoted = !quoted;
            } else if (!quoted) {
                if (ch == ',') commas++;
                else if (ch == ';') semicolons++;
                else if (ch == '\t') tabs++;
            }
        }

        if (semicolons == 0 && tabs == 0 && commas == 0) return ',';
        if (semicolons >= tabs && semicolons >= commas) return ';';
        if (tabs >= commas) return '\t';
        return ',';
    }

    static List<Map<String, String>> toRowMaps(List<List<String>> records, int headerIdx) {
        List<String> headers = uniqueHeaders(records.get(headerIdx));
        List<Map<String, String>> rows = new ArrayList<>();

        for (int i = headerIdx + 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                String value = c < record.size() && record.get(c) != null ? record.get(c).trim() : "";
                row.put(headers.get(c), value);
            }
            rows.add(row);
        }
        return rows;
    }

    private static List<String> uniqueHeaders(List<String> rawHeaders) {
        List<String> headers = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (int c = 0; c < rawHeaders.size(); c++) {
            String header = rawHeaders.get(c) == null ? "" : rawHeaders.get(c).trim();
            if (header.isEmpty()) header = "COLUMN_" + (c + 1);

            int count = seen.merge(header, 1, Integer::sum);
            headers.add(count == 1 ? header : header + "_" + count);
        }
        return headers;
    }

    private static List<List<String>> dropBlankRecords(List<List<String>> records) {
        List<List<String>> out = new ArrayList<>();
        for (List<String> record : records) {
            boolean blank = record.stream().allMatch(v -> v == null || v.isBlank());
            if (!blank) out.add(record);
        }
        return out;
    }

    private static String renderText(List<List<String>> records) {
        StringBuilder sb = new StringBuilder();
        for (List<String> record : records) {
            if (!sb.isEmpty()) sb.append('\n');
            sb.append(String.join(" | ", record.stream().map(v -> v == null ? "" : v.trim()).toList()));
        }
        return sb.toString();
    }

    /**
     * UTF-8 quando válido (sem BOM); senão windows-1252, comum em exportações bancárias.
     */
    static String decodeText(byte[] bytes) {
        int offset = 0;
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buffer)
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("[Parser] Content is not valid UTF-8, decoding as {}", FALLBACK_CHARSET);
            return new String(bytes, offset, bytes.length - offset, FALLBACK_CHARSET);
        }
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
