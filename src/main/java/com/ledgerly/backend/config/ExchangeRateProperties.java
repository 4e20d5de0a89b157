package com.ledgerly.backend.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Fonte de cotações (DolarAPI) usada na normalização de moeda.
 * Prefixo "ledgerly.exchange-rate".
 */
@Data
@Component
@ConfigurationProperties(prefix = "ledgerly.exchange-rate")
public class ExchangeRateProperties {

    private String apiUrl = "https://dolarapi.com/v1/dolares/oficial";

    private int timeoutSeconds = 5;

    private String sourceName = "dolarapi.com";

    /**
     * Moedas de origem que a fonte sabe converter para a moeda de referência.
     */
    private List<String> supportedCurrencies = new ArrayList<>(List.of("ARS"));
}
