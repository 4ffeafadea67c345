package com.minicrm.backend.rules;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleValidatorTest {

    private final RuleValidator validator = new RuleValidator(FieldCatalog.standard());

    private static Rule rule(String id, String field, Operator operator, RuleValue value, DataType type) {
        return Rule.builder().id(id).field(field).operator(operator).value(value).dataType(type).build();
    }

    @Test
    void shouldAcceptValidTree() {
        RuleGroup group = RuleGroup.and(
                rule("r1", "totalSpent", Operator.GREATER_THAN, RuleValue.number(1000), DataType.NUMBER),
                RuleGroup.or(
                        rule("r2", "churnRisk", Operator.IN,
                                RuleValue.array(List.of(RuleValue.string("medium"), RuleValue.string("high"))),
                                DataType.STRING),
                        rule("r3", "emailOptIn", Operator.IS_FALSE, null, DataType.BOOLEAN)));

        assertDoesNotThrow(() -> validator.validate(group, "ruleGroups[0]"));
    }

    @Test
    void shouldReportUnknownFieldWithPathAndRuleId() {
        RuleGroup group = RuleGroup.and(
                rule("r1", "totalSpent", Operator.GREATER_THAN, RuleValue.number(1), DataType.NUMBER),
                RuleGroup.or(rule("r9", "creditScore", Operator.GREATER_THAN, RuleValue.number(700), DataType.NUMBER)));

        UnknownFieldException e = assertThrows(UnknownFieldException.class,
                () -> validator.validateAll(List.of(group)));
        assertEquals("ruleGroups[0].rules[1].rules[0]", e.getPath());
        assertEquals("r9", e.getRuleId());
    }

    @Test
    void shouldRejectDeclaredTypeMismatch() {
        RuleGroup group = RuleGroup.and(
                rule("r1", "totalSpent", Operator.EQUALS, RuleValue.string("1000"), DataType.STRING));

        InvalidRuleException e = assertThrows(InvalidRuleException.class, () -> validator.validate(group, "g"));
        assertTrue(e.getMessage().contains("has type number"));
    }

    @Test
    void shouldRejectOperatorTheFieldDoesNotAllow() {
        // number supports in, totalVisits does not
        RuleGroup group = RuleGroup.and(rule("r1", "totalVisits", Operator.IN,
                RuleValue.array(List.of(RuleValue.number(1))), DataType.NUMBER));

        assertThrows(InvalidRuleException.class, () -> validator.validate(group, "g"));
    }

    @Test
    void shouldRejectValueOutsideOptions() {
        RuleGroup group = RuleGroup.and(rule("r1", "status", Operator.IN,
                RuleValue.array(List.of(RuleValue.string("active"), RuleValue.string("dormant"))), DataType.STRING));

        InvalidRuleException e = assertThrows(InvalidRuleException.class, () -> validator.validate(group, "g"));
        assertTrue(e.getMessage().contains("dormant"));
    }

    @Test
    void shouldRejectReversedRange() {
        RuleGroup numbers = RuleGroup.and(rule("r1", "totalSpent", Operator.BETWEEN,
                RuleValue.array(List.of(RuleValue.number(500), RuleValue.number(100))), DataType.NUMBER));
        RuleGroup dates = RuleGroup.and(rule("r2", "lastVisit", Operator.BETWEEN,
                RuleValue.array(List.of(RuleValue.date(Instant.parse("2024-02-01T00:00:00Z")),
                        RuleValue.date(Instant.parse("2024-01-01T00:00:00Z")))), DataType.DATE));

        assertThrows(InvalidRuleException.class, () -> validator.validate(numbers, "g"));
        assertThrows(InvalidRuleException.class, () -> validator.validate(dates, "g"));
    }

    @Test
    void shouldAcceptEqualRangeBounds() {
        RuleGroup group = RuleGroup.and(rule("r1", "totalSpent", Operator.BETWEEN,
                RuleValue.array(List.of(RuleValue.number(100), RuleValue.number(100))), DataType.NUMBER));

        assertDoesNotThrow(() -> validator.validate(group, "g"));
    }

    @Test
    void shouldRejectValueOfWrongVariantForSingleValueOperator() {
        RuleGroup group = RuleGroup.and(rule("r1", "totalSpent", Operator.GREATER_THAN,
                RuleValue.string("1000"), DataType.NUMBER));

        InvalidRuleException e = assertThrows(InvalidRuleException.class,
                () -> validator.validate(group, "ruleGroups[0]"));
        assertEquals("ruleGroups[0].rules[0]", e.getPath());
        assertEquals("r1", e.getRuleId());
    }

    @Test
    void shouldRejectMissingValueForSingleValueOperator() {
        RuleGroup group = RuleGroup.and(rule("r1", "totalSpent", Operator.GREATER_THAN, null, DataType.NUMBER));

        InvalidRuleException e = assertThrows(InvalidRuleException.class, () -> validator.validate(group, "g"));
        assertTrue(e.getMessage().contains("requires a value"));
    }

    @Test
    void shouldRejectListWhereScalarExpected() {
        RuleGroup group = RuleGroup.and(rule("r1", "city", Operator.EQUALS,
                RuleValue.array(List.of(RuleValue.string("Mumbai"))), DataType.STRING));

        assertThrows(InvalidRuleException.class, () -> validator.validate(group, "g"));
    }

    @Test
    void shouldRejectValueForValuelessOperator() {
        RuleGroup group = RuleGroup.and(rule("r1", "emailOptIn", Operator.IS_TRUE, RuleValue.bool(true),
                DataType.BOOLEAN));

        InvalidRuleException e = assertThrows(InvalidRuleException.class, () -> validator.validate(group, "g"));
        assertTrue(e.getMessage().contains("takes no value"));
    }

    @Test
    void shouldRequireNonEmptyListOfMatchingItems() {
        RuleGroup scalar = RuleGroup.and(rule("r1", "channel", Operator.IN, RuleValue.string("email"),
                DataType.STRING));
        RuleGroup empty = RuleGroup.and(rule("r2", "channel", Operator.NOT_IN, RuleValue.array(List.of()),
                DataType.STRING));
        RuleGroup mixed = RuleGroup.and(rule("r3", "totalSpent", Operator.IN,
                RuleValue.array(List.of(RuleValue.number(100), RuleValue.string("200"))), DataType.NUMBER));

        assertThrows(InvalidRuleException.class, () -> validator.validate(scalar, "g"));
        assertThrows(InvalidRuleException.class, () -> validator.validate(empty, "g"));
        assertThrows(InvalidRuleException.class, () -> validator.validate(mixed, "g"));
    }

    @Test
    void shouldRequireTwoBoundsOfDeclaredTypeForRange() {
        RuleGroup single = RuleGroup.and(rule("r1", "totalSpent", Operator.BETWEEN,
                RuleValue.array(List.of(RuleValue.number(100))), DataType.NUMBER));
        RuleGroup strings = RuleGroup.and(rule("r2", "totalSpent", Operator.BETWEEN,
                RuleValue.array(List.of(RuleValue.string("a"), RuleValue.string("b"))), DataType.NUMBER));
        RuleGroup scalar = RuleGroup.and(rule("r3", "totalSpent", Operator.BETWEEN, RuleValue.number(100),
                DataType.NUMBER));

        assertThrows(InvalidRuleException.class, () -> validator.validate(single, "g"));
        assertThrows(InvalidRuleException.class, () -> validator.validate(strings, "g"));
        assertThrows(InvalidRuleException.class, () -> validator.validate(scalar, "g"));
    }

    @Test
    void shouldRequireNonNegativeWholeDayCount() {
        RuleGroup text = RuleGroup.and(rule("r1", "lastVisit", Operator.LAST_N_DAYS, RuleValue.string("thirty"),
                DataType.DATE));
        RuleGroup fraction = RuleGroup.and(rule("r2", "lastVisit", Operator.LAST_N_DAYS, RuleValue.number(1.5),
                DataType.DATE));
        RuleGroup negative = RuleGroup.and(rule("r3", "subscriptionExpiresAt", Operator.NEXT_N_DAYS,
                RuleValue.number(-7), DataType.DATE));
        RuleGroup valid = RuleGroup.and(rule("r4", "lastVisit", Operator.LAST_N_DAYS, RuleValue.number(30),
                DataType.DATE));

        assertThrows(InvalidRuleException.class, () -> validator.validate(text, "g"));
        assertThrows(InvalidRuleException.class, () -> validator.validate(fraction, "g"));
        assertThrows(InvalidRuleException.class, () -> validator.validate(negative, "g"));
        assertDoesNotThrow(() -> validator.validate(valid, "g"));
    }
}
