package com.ledgerly.backend.services.documents.extraction;

import java.util.regex.Pattern;

/**
 * Padrão de uma linha de transação. Grupos com índice 0 não existem no padrão.
 *
 * @param forceNegative o valor é sempre débito (ex.: reversos)
 * @param descriptionPrefix prefixo acrescentado à descrição capturada
 */
public record LinePattern(
        String id,
        Pattern regex,
        int dateGroup,
        int referenceGroup,
        int descriptionGroup,
        int amountGroup,
        boolean forceNegative,
        String descriptionPrefix
) {
}
