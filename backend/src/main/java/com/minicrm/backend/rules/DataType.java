package com.minicrm.backend.rules;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.minicrm.backend.rules.Operator.*;

/**
 * Value types a rule can be declared with, and the operators each one supports.
 */
public enum DataType {

    NUMBER("number", EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN,
            LESS_THAN_OR_EQUAL, BETWEEN, IN, NOT_IN, IS_EMPTY, IS_NOT_EMPTY)),
    STRING("string", EnumSet.of(EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH,
            IN, NOT_IN, IS_EMPTY, IS_NOT_EMPTY)),
    DATE("date", EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN,
            LESS_THAN_OR_EQUAL, BETWEEN, LAST_N_DAYS, NEXT_N_DAYS, IS_EMPTY, IS_NOT_EMPTY)),
    BOOLEAN("boolean", EnumSet.of(IS_TRUE, IS_FALSE)),
    ARRAY("array", EnumSet.of(CONTAINS, NOT_CONTAINS, IN, NOT_IN, IS_EMPTY, IS_NOT_EMPTY));

    private final String code;
    private final Set<Operator> operators;

    DataType(String code, EnumSet<Operator> operators) {
        this.code = code;
        this.operators = Collections.unmodifiableSet(operators);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Set<Operator> getOperators() {
        return operators;
    }

    public boolean supports(Operator operator) {
        return operators.contains(operator);
    }

    public static Optional<DataType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
