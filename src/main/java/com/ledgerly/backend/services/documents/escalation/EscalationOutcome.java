package com.ledgerly.backend.services.documents.escalation;

import com.ledgerly.backend.services.documents.model.ExtractionResult;

public record EscalationOutcome(ExtractionResult result, EscalationDecision decision, boolean needsReview) {

    public boolean escalationUnavailable() {
        return decision == EscalationDecision.QUOTA_EXHAUSTED || decision == EscalationDecision.CAPABILITY_UNAVAILABLE;
    }
}
