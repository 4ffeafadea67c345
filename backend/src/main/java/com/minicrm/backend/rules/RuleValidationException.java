package com.minicrm.backend.rules;

import lombok.Getter;

/**
 * Raised when a rule tree cannot be accepted. Carries the location of the offending
 * node, e.g. {@code ruleGroups[0].rules[2]}, and its client supplied id when present.
 */
@Getter
public abstract class RuleValidationException extends RuntimeException {

    private final String path;
    private final String ruleId;

    protected RuleValidationException(String message, String path, String ruleId) {
        super(message);
        this.path = path;
        this.ruleId = ruleId;
    }

    /**
     * Short machine readable error code used in API responses.
     */
    public abstract String getErrorCode();
}
