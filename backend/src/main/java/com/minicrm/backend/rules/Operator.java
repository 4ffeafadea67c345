package com.minicrm.backend.rules;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators available to segment rules.
 */
public enum Operator {

    EQUALS("equals", "Equal to", Arity.SINGLE, "=", "=="),
    NOT_EQUALS("not_equals", "Not equal to", Arity.SINGLE, "!="),
    GREATER_THAN("greater_than", "Greater than", Arity.SINGLE, ">", "after"),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal", "Greater than or equal", Arity.SINGLE, ">="),
    LESS_THAN("less_than", "Less than", Arity.SINGLE, "<", "before"),
    LESS_THAN_OR_EQUAL("less_than_or_equal", "Less than or equal", Arity.SINGLE, "<="),
    CONTAINS("contains", "Contains", Arity.SINGLE),
    NOT_CONTAINS("not_contains", "Does not contain", Arity.SINGLE),
    STARTS_WITH("starts_with", "Starts with", Arity.SINGLE),
    ENDS_WITH("ends_with", "Ends with", Arity.SINGLE),
    IN("in", "In list", Arity.LIST),
    NOT_IN("not_in", "Not in list", Arity.LIST),
    BETWEEN("between", "Between", Arity.RANGE),
    LAST_N_DAYS("last_n_days", "In the last N days", Arity.DAY_COUNT),
    NEXT_N_DAYS("next_n_days", "In the next N days", Arity.DAY_COUNT),
    IS_EMPTY("is_empty", "Is empty", Arity.NONE),
    IS_NOT_EMPTY("is_not_empty", "Is not empty", Arity.NONE),
    IS_TRUE("is_true", "Is true", Arity.NONE),
    IS_FALSE("is_false", "Is false", Arity.NONE);

    /**
     * Shape of the value an operator expects.
     */
    public enum Arity {
        /** No value. */
        NONE,
        SINGLE,
        LIST,
        /** Exactly two values, low then high. */
        RANGE,
        /** A non-negative whole number of days. */
        DAY_COUNT
    }

    private final String code;
    private final String label;
    private final Arity arity;
    private final List<String> aliases;

    Operator(String code, String label, Arity arity, String... aliases) {
        this.code = code;
        this.label = label;
        this.arity = arity;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public Arity getArity() {
        return arity;
    }

    public boolean requiresValue() {
        return arity != Arity.NONE;
    }

    /**
     * Resolve an operator from its code or one of the legacy symbolic aliases.
     */
    public static Optional<Operator> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Operator operator : values()) {
            if (operator.code.equals(normalized) || operator.aliases.contains(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
