package com.ledgerly.backend.services.quota;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

public record QuotaState(UUID ownerId, String periodKey, int used, int limit) {

    public int remaining() {
        return Math.max(0, limit - used);
    }

    public boolean available() {
        return used < limit;
    }

    /**
     * Primeiro dia do período seguinte, quando o contador volta a zero.
     */
    public LocalDate resetDate() {
        return YearMonth.parse(periodKey).plusMonths(1).atDay(1);
    }
}
