package com.minicrm.backend.rules;

public class InvalidRuleException extends RuleValidationException {

    public InvalidRuleException(String message, String path, String ruleId) {
        super(message, path, ruleId);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_RULE";
    }
}
