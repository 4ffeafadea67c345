package com.minicrm.backend.model;

/**
 * How a segment's rules were obtained from natural language: straight from the language
 * model, or from the keyword fallback table.
 */
public enum RuleConfidence {
    HIGH,
    LOW
}
