package com.ledgerly.backend.classification.rules;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.ledgerly.backend.classification.entity.CategoryRule;
import com.ledgerly.backend.enums.RuleMatchField;

/**
 * Avalia uma regra contra descrição/comerciante.
 * Três modos: substring literal, curinga ({@code %} = qualquer sequência) e expressão regular.
 */
public final class CategoryRuleMatcher {

    private static final String WILDCARD = "%";

    private CategoryRuleMatcher() {
    }

    public static boolean matches(CategoryRule rule, String description, String merchant) {
        if (rule == null || rule.getKeyword() == null || rule.getKeyword().isEmpty()) return false;

        String text = searchText(rule.getMatchField(), description, merchant);
        if (text.isEmpty()) return false;

        if (rule.isPattern()) {
            return regexFind(rule.getKeyword(), text, rule.isCaseSensitive());
        }
        if (rule.getKeyword().contains(WILDCARD)) {
            return regexFind(wildcardToRegex(rule.getKeyword()), text, rule.isCaseSensitive());
        }
        if (rule.isCaseSensitive()) {
            return text.contains(rule.getKeyword());
        }
        return text.toLowerCase(Locale.ROOT).contains(rule.getKeyword().toLowerCase(Locale.ROOT));
    }

    static String searchText(RuleMatchField field, String description, String merchant) {
        String d = description == null ? "" : description;
        String m = merchant == null ? "" : merchant;
        if (field == null) field = RuleMatchField.DESCRIPTION;
        return switch (field) {
            case DESCRIPTION -> d;
            case MERCHANT -> m;
            case BOTH -> (d + " " + m).trim();
        };
    }

    /**
     * "CAFE%PALERMO" -> \QCAFE\E.*\QPALERMO\E
     */
    static String wildcardToRegex(String keyword) {
        StringBuilder sb = new StringBuilder();
        String[] parts = keyword.split(Pattern.quote(WILDCARD), -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(".*");
            if (!parts[i].isEmpty()) sb.append(Pattern.quote(parts[i]));
        }
        return sb.toString();
    }

    private static boolean regexFind(String regex, String text, boolean caseSensitive) {
        try {
            int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            return Pattern.compile(regex, flags).matcher(text).find();
        } catch (PatternSyntaxException e) {
            // regra inválida nunca casa
            return false;
        }
    }
}
