package com.ledgerly.backend.services.documents.quality;

import java.util.List;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.services.documents.model.TransactionCandidate;

import lombok.extern.slf4j.Slf4j;

/**
 * Calcula a confiança (0-100) de uma extração inteira.
 *
 * Base 50
 * + até 20 pela quantidade de transações (2 pontos cada)
 * + até 10 proporcional às transações com data
 * + até 10 proporcional às transações com valor
 * + até 10 proporcional às transações com descrição de mais de 3 caracteres
 *
 * Sem transações a confiança é 0.
 */
@Component
@Slf4j
public class PipelineConfidenceEvaluator {

    private static final int BASE_SCORE = 50;
    private static final int MAX_COUNT_POINTS = 20;
    private static final int POINTS_PER_CANDIDATE = 2;
    private static final int MAX_FIELD_POINTS = 10;
    private static final int MIN_DESCRIPTION_LENGTH = 3;

    public int evaluate(List<TransactionCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            log.debug("[Confidence] No candidates; score=0");
            return 0;
        }

        int total = candidates.size();
        long withDate = candidates.stream().filter(c -> c.getDate() != null).count();
        long withAmount = candidates.stream().filter(c -> c.getAmount() != null).count();
        long withDescription = candidates.stream()
                .filter(c -> c.getDescription() != null && c.getDescription().trim().length() > MIN_DESCRIPTION_LENGTH)
                .count();

        double score = BASE_SCORE
                + Math.min(total * POINTS_PER_CANDIDATE, MAX_COUNT_POINTS)
                + ratio(withDate, total) * MAX_FIELD_POINTS
                + ratio(withAmount, total) * MAX_FIELD_POINTS
                + ratio(withDescription, total) * MAX_FIELD_POINTS;

        int finalScore = (int) Math.max(0, Math.min(100, Math.round(score)));
        log.debug("[Confidence] candidates={} date={} amount={} description={} -> score={}",
                total, withDate, withAmount, withDescription, finalScore);
        return finalScore;
    }

    private static double ratio(long part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }
}
