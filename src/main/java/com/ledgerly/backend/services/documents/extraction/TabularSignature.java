package com.ledgerly.backend.services.documents.extraction;

import java.util.List;

import com.ledgerly.backend.services.documents.util.NormalizeUtil;

/**
 * Conjunto de colunas que identifica um layout. Cada grupo exige que algum cabeçalho
 * contenha ao menos um dos trechos do grupo.
 */
public record TabularSignature(List<List<String>> requiredGroups) {

    public static TabularSignature allOf(List<List<String>> groups) {
        return new TabularSignature(groups);
    }

    public boolean matches(List<String> headers) {
        List<String> normalized = headers.stream().map(NormalizeUtil::normalizeHeader).toList();
        for (List<String> group : requiredGroups) {
            boolean found = normalized.stream().anyMatch(h -> group.stream().anyMatch(h::contains));
            if (!found) return false;
        }
        return true;
    }
}
