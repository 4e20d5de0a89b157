package com.ledgerly.backend.services.currency;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.ledgerly.backend.config.ExchangeRateProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cotação oficial ARS/USD (campo "venta") da DolarAPI.
 * A API só expõe a cotação corrente; ela é usada para a data pedida e fica em cache por data.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DolarApiExchangeRateSource implements ExchangeRateSource {

    private final RestTemplate restTemplate;
    private final ExchangeRateProperties properties;

    @Override
    public BigDecimal fetchRate(LocalDate date, String from, String to) {
        String fromCode = from == null ? "" : from.toUpperCase(Locale.ROOT);
        String toCode = to == null ? "" : to.toUpperCase(Locale.ROOT);

        if (!"USD".equals(toCode) || !properties.getSupportedCurrencies().contains(fromCode)) {
            throw new ExchangeRateUnavailableException("Unsupported currency pair " + fromCode + "->" + toCode);
        }

        JsonNode body;
        try {
            body = restTemplate.getForObject(properties.getApiUrl(), JsonNode.class);
        } catch (RestClientException e) {
            throw new ExchangeRateUnavailableException("Rate source request failed: " + e.getMessage(), e);
        }

        if (body == null || !body.hasNonNull("venta")) {
            throw new ExchangeRateUnavailableException("Rate source returned no 'venta' field");
        }

        BigDecimal rate = body.get("venta").decimalValue();
        if (rate.signum() <= 0) {
            throw new ExchangeRateUnavailableException("Rate source returned non-positive rate " + rate);
        }

        log.info("[Currency] Fetched {}->{} rate={} for {} from {}", fromCode, toCode, rate, date, sourceName());
        return rate;
    }

    @Override
    public String sourceName() {
        return properties.getSourceName();
    }
}
