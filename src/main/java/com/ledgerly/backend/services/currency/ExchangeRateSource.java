package com.ledgerly.backend.services.currency;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Fonte externa de cotações.
 */
public interface ExchangeRateSource {

    /**
     * @return unidades de {@code from} por 1 unidade de {@code to}
     * @throws ExchangeRateUnavailableException quando o par não é suportado ou a fonte falha
     */
    BigDecimal fetchRate(LocalDate date, String from, String to);

    String sourceName();
}
