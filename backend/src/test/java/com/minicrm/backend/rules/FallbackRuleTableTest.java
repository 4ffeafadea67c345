package com.minicrm.backend.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FallbackRuleTableTest {

    private final FallbackRuleTable table = FallbackRuleTable.standard();

    @Test
    void shouldMatchKeywordCaseInsensitively() {
        FallbackRuleTable.Entry entry = table.match("Show me HIGH VALUE shoppers").orElseThrow();
        assertEquals("high value", entry.getKeyword());
        Rule rule = (Rule) entry.getRuleGroup().getChildren().get(0);
        assertEquals("totalSpent", rule.getField());
        assertEquals(Operator.GREATER_THAN_OR_EQUAL, rule.getOperator());
    }

    @Test
    void shouldPreferInactiveOverActive() {
        assertEquals("inactive", table.match("inactive customers").orElseThrow().getKeyword());
        assertEquals("active", table.match("active customers").orElseThrow().getKeyword());
    }

    @Test
    void shouldUseDefaultEntryWhenNothingMatches() {
        FallbackRuleTable.Entry entry = table.match("people who like jazz").orElseThrow();
        assertNull(entry.getKeyword());
        assertEquals("fallback-default", entry.getRuleGroup().getId());
        assertEquals(entry, table.match(null).orElseThrow());
    }

    @Test
    void shouldOnlyContainRulesValidAgainstTheCatalog() {
        RuleValidator validator = new RuleValidator(FieldCatalog.standard());
        for (FallbackRuleTable.Entry entry : table.getEntries()) {
            assertDoesNotThrow(() -> validator.validate(entry.getRuleGroup(), "fallback"), entry.getKeyword());
        }
        assertDoesNotThrow(() -> validator.validate(table.getDefaultEntry().getRuleGroup(), "fallback"));
        assertEquals("2024.1", table.getVersion());
    }
}
