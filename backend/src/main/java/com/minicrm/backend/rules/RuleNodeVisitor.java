package com.minicrm.backend.rules;

public interface RuleNodeVisitor<R> {

    R visitRule(Rule rule);

    R visitGroup(RuleGroup group);
}
