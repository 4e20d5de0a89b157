package com.ledgerly.backend.services.documents.extraction;

import java.util.List;

import com.ledgerly.backend.services.documents.util.NormalizeUtil;

/**
 * Como achar a coluna de um papel: primeiro por nome exato, depois por trecho contido.
 * Os nomes são comparados já normalizados (maiúsculas, sem acento e sem pontuação).
 */
public record ColumnRule(ColumnRole role, List<String> exact, List<String> contains) {

    public static ColumnRule exact(ColumnRole role, String... names) {
        return new ColumnRule(role, List.of(names), List.of());
    }

    public static ColumnRule contains(ColumnRole role, String... fragments) {
        return new ColumnRule(role, List.of(), List.of(fragments));
    }

    public static ColumnRule of(ColumnRole role, List<String> exact, List<String> contains) {
        return new ColumnRule(role, exact, contains);
    }

    /**
     * @return o cabeçalho original que atende a regra, ou null
     */
    public String resolve(List<String> headers) {
        for (String header : headers) {
            String normalized = NormalizeUtil.normalizeHeader(header);
            if (exact.contains(normalized)) return header;
        }
        for (String header : headers) {
            String normalized = NormalizeUtil.normalizeHeader(header);
            for (String fragment : contains) {
                if (normalized.contains(fragment)) return header;
            }
        }
        return null;
    }
}
