package com.ledgerly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Configurações do pipeline de ingestão.
 * Carrega de application.properties com prefixo "ledgerly.pipeline".
 *
 * Exemplo:
 * ledgerly.pipeline.escalation-threshold=60
 * ledgerly.pipeline.force-review-on-ai=true
 * ledgerly.pipeline.reference-currency=USD
 * ledgerly.pipeline.default-currency=ARS
 */
@Data
@Component
@ConfigurationProperties(prefix = "ledgerly.pipeline")
public class PipelineProperties {

    /**
     * Abaixo deste valor de confiança (0-100) a extração determinística é escalada.
     */
    private int escalationThreshold = 60;

    /**
     * Todo resultado vindo da IA é marcado para revisão.
     */
    private boolean forceReviewOnAi = true;

    /**
     * Moeda de referência para a conversão (amountInReferenceCurrency).
     */
    private String referenceCurrency = "USD";

    /**
     * Moeda assumida quando o documento não indica outra.
     */
    private String defaultCurrency = "ARS";

    /**
     * Quantas linhas da planilha são inspecionadas na busca pelo cabeçalho.
     */
    private int headerScanRows = 20;

    /**
     * Mínimo de palavras-chave para uma linha ser considerada cabeçalho.
     */
    private int minHeaderKeywords = 2;

    public String getDescription() {
        return String.format(
                "PipelineProperties{threshold=%d, forceReviewOnAi=%s, reference=%s, default=%s, headerScan=%d/%d}",
                escalationThreshold,
                forceReviewOnAi,
                referenceCurrency,
                defaultCurrency,
                headerScanRows,
                minHeaderKeywords);
    }
}
