package com.minicrm.backend.service;

import com.minicrm.backend.model.RuleConfidence;
import com.minicrm.backend.model.RuleGroupDefinition;
import com.minicrm.backend.rules.RuleGroup;

/**
 * Outcome of converting natural language to a rule group. {@code ruleGroup} and
 * {@code definition} are null only for {@link Status#FAILURE}.
 */
public record RuleConversionResult(
        Status status,
        RuleConfidence confidence,
        RuleGroup ruleGroup,
        RuleGroupDefinition definition,
        String description,
        String reason,
        String fallbackVersion) {

    public enum Status {
        SUCCESS,
        FALLBACK,
        FAILURE
    }

    static RuleConversionResult success(RuleGroup group, RuleGroupDefinition definition, String description) {
        return new RuleConversionResult(Status.SUCCESS, RuleConfidence.HIGH, group, definition, description,
                null, null);
    }

    static RuleConversionResult fallback(RuleGroup group, RuleGroupDefinition definition, String description,
            String reason, String fallbackVersion) {
        return new RuleConversionResult(Status.FALLBACK, RuleConfidence.LOW, group, definition, description,
                reason, fallbackVersion);
    }

    static RuleConversionResult failure(String reason) {
        return new RuleConversionResult(Status.FAILURE, null, null, null, null, reason, null);
    }
}
