package com.ledgerly.backend.services.documents.extraction;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Configuração de uma estratégia de extração. Novos layouts entram como novas instâncias
 * em {@link ExtractionProfiles}, não como novas classes.
 *
 * Campos que não se aplicam ao tipo do perfil ficam vazios ou null.
 */
public record ExtractionProfile(
        String id,
        String version,
        ProfileKind kind,
        String bankId,
        String bankName,
        TabularSignature signature,
        List<ColumnRule> columnRules,
        List<LinePattern> linePatterns,
        List<String> skipLineKeywords,
        int minLineLength,
        int minDescriptionLength,
        Pattern dateToken,
        Pattern amountToken,
        Pattern statementDatePattern,
        List<DateLayout> dateLayouts,
        String defaultCurrency,
        double candidateConfidence
) {

    public ExtractionProfile {
        columnRules = columnRules == null ? List.of() : List.copyOf(columnRules);
        linePatterns = linePatterns == null ? List.of() : List.copyOf(linePatterns);
        skipLineKeywords = skipLineKeywords == null ? List.of() : List.copyOf(skipLineKeywords);
        dateLayouts = dateLayouts == null ? List.of() : List.copyOf(dateLayouts);
    }

    public ColumnRule ruleFor(ColumnRole role) {
        for (ColumnRule rule : columnRules) {
            if (rule.role() == role) return rule;
        }
        return null;
    }

    public String describe() {
        return id + "@" + version;
    }
}
