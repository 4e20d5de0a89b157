package com.ledgerly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Configurações da extração assistida por IA (OpenAI).
 * Prefixo "ledgerly.ai".
 */
@Data
@Component
@ConfigurationProperties(prefix = "ledgerly.ai")
public class AiExtractionProperties {

    private boolean enabled = true;

    private String apiKey;

    private String model = "gpt-4o-mini";

    private int maxTokens = 4096;

    private double temperature = 0.0;

    private int timeoutSeconds = 60;

    private int maxAttempts = 3;

    /**
     * Limite mensal padrão de chamadas por usuário.
     */
    private int monthlyLimit = 20;

    public boolean isConfigured() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    public String getDescription() {
        return String.format(
                "AiExtractionProperties{enabled=%s, configured=%s, model=%s, maxTokens=%d, timeout=%ds, monthlyLimit=%d}",
                enabled,
                isConfigured(),
                model,
                maxTokens,
                timeoutSeconds,
                monthlyLimit);
    }
}
