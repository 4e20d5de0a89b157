package com.ledgerly.backend.services.documents.parsing;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Component;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;

/**
 * Lê registros de texto delimitado (CSV/TSV) com OpenCSV.
 */
@Component
public class DelimitedTextReader {

    public List<List<String>> readRecords(String content, char delimiter) throws IOException {
        if (content == null || content.isBlank()) return List.of();

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(content))
                .withCSVParser(new CSVParserBuilder()
                        .withSeparator(delimiter)
                        .withIgnoreLeadingWhiteSpace(true)
                        .build())
                .build()) {
            List<List<String>> records = new ArrayList<>();
            for (String[] line : reader.readAll()) {
                records.add(Arrays.asList(line));
            }
            return records;
        } catch (CsvException e) {
            throw new IOException("Malformed delimited content at line " + e.getLineNumber(), e);
        }
    }
}
