package com.minicrm.backend.rules;

import lombok.Builder;
import lombok.Value;

/**
 * Leaf predicate comparing one catalog field against a value.
 * {@code value} is null for operators that take no operand.
 */
@Value
@Builder
public class Rule implements RuleNode {

    String id;
    String field;
    Operator operator;
    RuleValue value;
    DataType dataType;

    @Override
    public <R> R accept(RuleNodeVisitor<R> visitor) {
        return visitor.visitRule(this);
    }

    @Override
    public String toString() {
        return field + " " + operator.getCode() + (value != null ? " " + value : "");
    }
}
