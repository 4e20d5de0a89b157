package com.ledgerly.backend.services.currency;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ConvertedAmount(BigDecimal amount, BigDecimal rate, LocalDate rateDate) {
}
