package com.ledgerly.backend.services.documents.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.services.documents.model.TransactionCandidate;

import lombok.extern.slf4j.Slf4j;

/**
 * Extrai transações de texto livre (PDF), linha a linha.
 */
@Component
@Slf4j
public class LineExtractor {

    ProfileExtraction extract(String text, ExtractionProfile profile) {
        if (text == null || text.isBlank()) return new ProfileExtraction(List.of(), 0, null);

        List<TransactionCandidate> candidates = new ArrayList<>();
        int skipped = 0;

        for (String rawLine : text.split("\\r?\\n")) {
            String line = rawLine.replace('\u00A0', ' ').trim();
            if (line.length() < profile.minLineLength()) continue;

            LineMatch match = profile.kind() == ProfileKind.GENERIC_LINE
                    ? matchGeneric(line, profile)
                    : matchPatterns(line, profile);
            if (match == null) continue;

            TransactionCandidate candidate = toCandidate(line, match, profile);
            if (candidate == null) {
                skipped++;
                continue;
            }
            candidates.add(candidate);
        }

        if (skipped > 0) {
            log.info("[Extractor] profile={} skipped {} line(s)", profile.id(), skipped);
        }

        LocalDate statementDate = StatementDateParser.find(text, profile.statementDatePattern(), profile.dateLayouts());
        return new ProfileExtraction(candidates, skipped, statementDate);
    }

    private LineMatch matchPatterns(String line, ExtractionProfile profile) {
        for (LinePattern pattern : profile.linePatterns()) {
            Matcher m = pattern.regex().matcher(line);
            if (!m.find()) continue;

            String description = m.group(pattern.descriptionGroup()).trim();
            if (containsSkipKeyword(description, profile)) return null;

            String reference = pattern.referenceGroup() > 0 ? m.group(pattern.referenceGroup()).trim() : null;
            return new LineMatch(
                    m.group(pattern.dateGroup()),
                    reference,
                    pattern.descriptionPrefix() + description,
                    m.group(pattern.amountGroup()),
                    pattern.forceNegative());
        }
        return null;
    }

    /**
     * Data em qualquer posição e o último token com cara de valor monetário.
     */
    private LineMatch matchGeneric(String line, ExtractionProfile profile) {
        Matcher dateMatcher = profile.dateToken().matcher(line);
        if (!dateMatcher.find()) return null;

        Matcher amountMatcher = profile.amountToken().matcher(line);
        int amountStart = -1;
        int amountEnd = -1;
        while (amountMatcher.find()) {
            // ignora tokens que se sobrepõem à data
            if (amountMatcher.start() < dateMatcher.end() && amountMatcher.end() > dateMatcher.start()) continue;
            amountStart = amountMatcher.start();
            amountEnd = amountMatcher.end();
        }
        if (amountStart < 0) return null;

        String amount = line.substring(amountStart, amountEnd);
        String description = removeRange(line, amountStart, amountEnd, dateMatcher.start(), dateMatcher.end());
        description = description.replaceAll("[|;]", " ").replaceAll("\\s+", " ").trim();

        return new LineMatch(dateMatcher.group(1), null, description, amount, false);
    }

    private TransactionCandidate toCandidate(String line, LineMatch match, ExtractionProfile profile) {
        if (match.description().length() < profile.minDescriptionLength()) {
            log.debug("[Extractor] Skipping line with short description: '{}'", line);
            return null;
        }

        LocalDate date = StatementDateParser.parse(match.date(), profile.dateLayouts());
        if (date == null) {
            log.debug("[Extractor] Skipping line with unparseable date '{}': '{}'", match.date(), line);
            return null;
        }

        BigDecimal amount = AmountParser.parse(match.amount());
        if (amount == null || amount.signum() == 0) {
            log.debug("[Extractor] Skipping line with unparseable amount '{}': '{}'", match.amount(), line);
            return null;
        }
        if (match.forceNegative()) amount = amount.abs().negate();

        return TransactionCandidate.builder()
                .date(date)
                .description(match.description())
                .merchant(MerchantExtractor.extract(match.description()))
                .amount(amount.setScale(2, RoundingMode.HALF_UP))
                .referenceNumber(match.reference() == null || match.reference().isBlank() ? null : match.reference())
                .rawSource(Map.of("line", line))
                .extractionConfidence(profile.candidateConfidence())
                .currency(currencyFor(line, profile))
                .build();
    }

    private static String currencyFor(String line, ExtractionProfile profile) {
        String upper = line.toUpperCase(Locale.ROOT);
        if (upper.contains("U$S") || upper.contains("USD")) return "USD";
        return profile.defaultCurrency();
    }

    private static boolean containsSkipKeyword(String description, ExtractionProfile profile) {
        String lower = description.toLowerCase(Locale.ROOT);
        for (String keyword : profile.skipLineKeywords()) {
            if (lower.contains(keyword)) return true;
        }
        return false;
    }

    private static String removeRange(String line, int aStart, int aEnd, int bStart, int bEnd) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            boolean inA = i >= aStart && i < aEnd;
            boolean inB = i >= bStart && i < bEnd;
            sb.append(inA || inB ? ' ' : line.charAt(i));
        }
        return sb.toString();
    }

    private record LineMatch(String date, String reference, String description, String amount, boolean forceNegative) {}
}
