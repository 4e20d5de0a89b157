package com.ledgerly.backend.enums;

/**
 * Condições observadas durante o processamento de um documento.
 * {@link #UNSUPPORTED_FORMAT} e {@link #PROCESSING_ERROR} interrompem o documento; as demais são reportadas.
 */
public enum PipelineCondition {
    UNSUPPORTED_FORMAT(true),
    CLASSIFICATION_INCONCLUSIVE(false),
    ROW_PARSE_SKIPPED(false),
    ESCALATION_UNAVAILABLE(false),
    CURRENCY_CONVERSION_UNAVAILABLE(false),
    DUPLICATE_REFERENCE(false),
    ROW_PERSIST_REJECTED(false),
    PROCESSING_ERROR(true);

    private final boolean fatal;

    PipelineCondition(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
