package com.minicrm.backend.rules;

/**
 * A node of a segment rule tree: either a {@link Rule} leaf or a nested {@link RuleGroup}.
 */
public interface RuleNode {

    /**
     * Client supplied identifier, may be null.
     */
    String getId();

    <R> R accept(RuleNodeVisitor<R> visitor);
}
