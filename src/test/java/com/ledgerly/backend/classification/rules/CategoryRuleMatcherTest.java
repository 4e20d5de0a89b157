package com.ledgerly.backend.classification.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.ledgerly.backend.classification.entity.CategoryRule;
import com.ledgerly.backend.enums.RuleMatchField;

class CategoryRuleMatcherTest {

    @Test
    void substringIsCaseInsensitiveByDefault() {
        CategoryRule rule = rule("netflix", RuleMatchField.DESCRIPTION, false, false);

        assertTrue(CategoryRuleMatcher.matches(rule, "DEBITO NETFLIX.COM", null));
        assertFalse(CategoryRuleMatcher.matches(rule, "SPOTIFY", null));
    }

    @Test
    void caseSensitiveSubstring() {
        CategoryRule rule = rule("Netflix", RuleMatchField.DESCRIPTION, true, false);

        assertTrue(CategoryRuleMatcher.matches(rule, "Pago Netflix", null));
        assertFalse(CategoryRuleMatcher.matches(rule, "PAGO NETFLIX", null));
    }

    @Test
    void wildcardMatchesAnySequence() {
        CategoryRule rule = rule("cafe%palermo", RuleMatchField.DESCRIPTION, false, false);

        assertTrue(CategoryRuleMatcher.matches(rule, "CAFE MARTINEZ PALERMO", null));
        assertFalse(CategoryRuleMatcher.matches(rule, "PALERMO CAFE", null));
        assertEquals("\\QCAFE\\E.*\\QPALERMO\\E", CategoryRuleMatcher.wildcardToRegex("CAFE%PALERMO"));
    }

    @Test
    void wildcardQuotesRegexCharacters() {
        CategoryRule rule = rule("A.B%", RuleMatchField.DESCRIPTION, false, false);

        assertTrue(CategoryRuleMatcher.matches(rule, "x A.B y", null));
        assertFalse(CategoryRuleMatcher.matches(rule, "x AXB y", null));
    }

    @Test
    void regexRule() {
        CategoryRule rule = rule("^(uber|cabify)\\b", RuleMatchField.DESCRIPTION, false, true);

        assertTrue(CategoryRuleMatcher.matches(rule, "UBER TRIP 1234", null));
        assertFalse(CategoryRuleMatcher.matches(rule, "PAGO UBER", null));
    }

    @Test
    void invalidRegexNeverMatches() {
        CategoryRule rule = rule("([unclosed", RuleMatchField.DESCRIPTION, false, true);

        assertFalse(CategoryRuleMatcher.matches(rule, "([unclosed", null));
    }

    @Test
    void matchFieldSelectsTheSearchedText() {
        CategoryRule merchantRule = rule("coto", RuleMatchField.MERCHANT, false, false);
        CategoryRule bothRule = rule("compra%coto", RuleMatchField.BOTH, false, false);

        assertFalse(CategoryRuleMatcher.matches(merchantRule, "COTO SUC 45", "OTRO"));
        assertTrue(CategoryRuleMatcher.matches(merchantRule, "COMPRA", "COTO"));
        assertTrue(CategoryRuleMatcher.matches(bothRule, "COMPRA DEBITO", "COTO"));
        assertEquals("COMPRA", CategoryRuleMatcher.searchText(RuleMatchField.BOTH, "COMPRA", null));
    }

    @Test
    void emptyTextNeverMatches() {
        assertFalse(CategoryRuleMatcher.matches(rule("x", RuleMatchField.MERCHANT, false, false), "x", null));
        assertFalse(CategoryRuleMatcher.matches(null, "x", null));
    }

    private static CategoryRule rule(String keyword, RuleMatchField field, boolean caseSensitive, boolean pattern) {
        return CategoryRule.builder()
                .ownerId(UUID.randomUUID())
                .keyword(keyword)
                .matchField(field)
                .caseSensitive(caseSensitive)
                .pattern(pattern)
                .categoryId(UUID.randomUUID())
                .build();
    }
}
