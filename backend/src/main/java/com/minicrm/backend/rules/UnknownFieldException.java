package com.minicrm.backend.rules;

import lombok.Getter;

@Getter
public class UnknownFieldException extends RuleValidationException {

    private final String field;

    public UnknownFieldException(String field) {
        this(field, null, null);
    }

    public UnknownFieldException(String field, String path, String ruleId) {
        super("Unknown field: " + field, path, ruleId);
        this.field = field;
    }

    @Override
    public String getErrorCode() {
        return "UNKNOWN_FIELD";
    }
}
