package com.minicrm.backend.rules;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Boolean combination of child nodes. An empty group places no restriction.
 */
@Value
public class RuleGroup implements RuleNode {

    String id;
    Logic logic;
    List<RuleNode> children;

    public RuleGroup(String id, Logic logic, List<? extends RuleNode> children) {
        this.id = id;
        this.logic = logic;
        this.children = List.copyOf(children);
    }

    public static RuleGroup and(RuleNode... children) {
        return new RuleGroup(null, Logic.AND, Arrays.asList(children));
    }

    public static RuleGroup or(RuleNode... children) {
        return new RuleGroup(null, Logic.OR, Arrays.asList(children));
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public <R> R accept(RuleNodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
