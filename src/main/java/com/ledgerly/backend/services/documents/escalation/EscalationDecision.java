package com.ledgerly.backend.services.documents.escalation;

public enum EscalationDecision {
    /** Confiança suficiente; resultado determinístico é final. */
    NOT_NEEDED,
    /** IA chamada com sucesso; resultado substituído. */
    AI_ACCEPTED,
    /** IA chamada e falhou; resultado determinístico mantido (hybrid). */
    AI_FAILED,
    /** Sem cota no período. */
    QUOTA_EXHAUSTED,
    /** Serviço de IA não configurado. */
    CAPABILITY_UNAVAILABLE
}
