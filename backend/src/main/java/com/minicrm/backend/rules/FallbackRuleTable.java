package com.minicrm.backend.rules;

import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic keyword to rule mapping used when the language model cannot produce a
 * usable rule tree. Entries are tried in declaration order; the first keyword found in
 * the query (case-insensitive substring) wins, otherwise the default entry applies.
 */
@Value
public class FallbackRuleTable {

    String version;
    List<Entry> entries;
    Entry defaultEntry;

    public FallbackRuleTable(String version, List<Entry> entries, Entry defaultEntry) {
        this.version = version;
        this.entries = List.copyOf(entries);
        this.defaultEntry = defaultEntry;
    }

    @Value
    public static class Entry {
        /** Lower case keyword; null for the default entry. */
        String keyword;
        String description;
        RuleGroup ruleGroup;
    }

    public Optional<Entry> match(String query) {
        if (query != null) {
            String normalized = query.toLowerCase(Locale.ROOT);
            for (Entry entry : entries) {
                if (normalized.contains(entry.getKeyword())) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.ofNullable(defaultEntry);
    }

    public static FallbackRuleTable standard() {
        return new FallbackRuleTable("2024.1", List.of(
                entry("inactive", "Customers who have not visited in over 90 days",
                        number("daysSinceLastVisit", Operator.GREATER_THAN, 90)),
                entry("high value", "Customers who have spent at least 1000",
                        number("totalSpent", Operator.GREATER_THAN_OR_EQUAL, 1000)),
                entry("recent customers", "Customers who registered in the last 30 days",
                        number("registrationDaysAgo", Operator.LESS_THAN_OR_EQUAL, 30)),
                entry("frequent", "Customers with at least 5 orders",
                        number("orderCount", Operator.GREATER_THAN_OR_EQUAL, 5)),
                entry("churn", "Customers at high risk of churning",
                        text("churnRisk", Operator.EQUALS, RuleValue.string("high"))),
                entry("email subscribers", "Customers who prefer email communication",
                        text("channel", Operator.IN,
                                RuleValue.array(List.of(RuleValue.string("email"), RuleValue.string("both"))))),
                entry("active", "Active customers",
                        text("status", Operator.EQUALS, RuleValue.string("active")))),
                entry(null, "Active customers",
                        text("status", Operator.EQUALS, RuleValue.string("active"))));
    }

    private static Entry entry(String keyword, String description, Rule rule) {
        return new Entry(keyword, description,
                new RuleGroup(keyword != null ? "fallback-" + keyword.replace(' ', '-') : "fallback-default",
                        Logic.AND, List.of(rule)));
    }

    private static Rule number(String field, Operator operator, double value) {
        return Rule.builder()
                .field(field)
                .operator(operator)
                .value(RuleValue.number(value))
                .dataType(DataType.NUMBER)
                .build();
    }

    private static Rule text(String field, Operator operator, RuleValue value) {
        return Rule.builder()
                .field(field)
                .operator(operator)
                .value(value)
                .dataType(DataType.STRING)
                .build();
    }
}
