package com.minicrm.backend.rules;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks a typed rule tree against the {@link FieldCatalog}: every field must exist, be
 * declared with its catalog type and use an operator that both the type and the field
 * allow. The value must have the shape the operator expects and the variant of the
 * declared type. Values of closed-set fields must be among the field's options and
 * {@code between} ranges must be ordered.
 * <p>
 * Children are addressed as {@code .rules[i]} in tree order.
 */
@Component
public class RuleValidator {

    private final FieldCatalog catalog;

    public RuleValidator(FieldCatalog catalog) {
        this.catalog = catalog;
    }

    public void validateAll(List<RuleGroup> groups) {
        for (int i = 0; i < groups.size(); i++) {
            validate(groups.get(i), "ruleGroups[" + i + "]");
        }
    }

    /**
     * @throws UnknownFieldException if a rule references a field outside the catalog
     * @throws InvalidRuleException  if a rule does not fit its field
     */
    public void validate(RuleGroup group, String path) {
        List<RuleNode> children = group.getChildren();
        for (int i = 0; i < children.size(); i++) {
            String childPath = path + ".rules[" + i + "]";
            children.get(i).accept(new RuleNodeVisitor<Void>() {
                @Override
                public Void visitRule(Rule rule) {
                    validateRule(rule, childPath);
                    return null;
                }

                @Override
                public Void visitGroup(RuleGroup nested) {
                    validate(nested, childPath);
                    return null;
                }
            });
        }
    }

    private void validateRule(Rule rule, String path) {
        if (!catalog.isValidField(rule.getField())) {
            throw new UnknownFieldException(rule.getField(), path, rule.getId());
        }
        FieldDefinition field = catalog.field(rule.getField());
        if (field.getDataType() != rule.getDataType()) {
            throw new InvalidRuleException("Field " + field.getName() + " has type " + field.getDataType().getCode()
                    + " but the rule declares " + rule.getDataType().getCode(), path, rule.getId());
        }
        Operator operator = rule.getOperator();
        if (!rule.getDataType().supports(operator) || !field.supports(operator)) {
            throw new InvalidRuleException("Operator " + operator.getCode() + " is not allowed for field "
                    + field.getName(), path, rule.getId());
        }
        checkValue(rule, path);
        if (field.hasOptions() && rule.getValue() != null) {
            checkOptions(field, rule.getValue(), path, rule.getId());
        }
        if (operator == Operator.BETWEEN) {
            checkRange((RuleValue.ArrayValue) rule.getValue(), path, rule.getId());
        }
    }

    private void checkValue(Rule rule, String path) {
        Operator operator = rule.getOperator();
        RuleValue value = rule.getValue();
        if (!operator.requiresValue()) {
            if (value != null) {
                throw new InvalidRuleException("Operator " + operator.getCode() + " takes no value", path, rule.getId());
            }
            return;
        }
        if (value == null) {
            throw new InvalidRuleException("Operator " + operator.getCode() + " requires a value", path, rule.getId());
        }
        switch (operator.getArity()) {
            case SINGLE -> checkScalar(rule.getDataType(), value, path, rule.getId());
            case LIST -> {
                RuleValue.ArrayValue list = asArray(operator, value, path, rule.getId());
                if (list.size() == 0) {
                    throw new InvalidRuleException("Operator " + operator.getCode()
                            + " requires at least one value", path, rule.getId());
                }
                list.getValues().forEach(item -> checkScalar(rule.getDataType(), item, path, rule.getId()));
            }
            case RANGE -> {
                RuleValue.ArrayValue range = asArray(operator, value, path, rule.getId());
                if (range.size() != 2) {
                    throw new InvalidRuleException("Operator between requires exactly two values [low, high]",
                            path, rule.getId());
                }
                range.getValues().forEach(item -> checkScalar(rule.getDataType(), item, path, rule.getId()));
            }
            case DAY_COUNT -> {
                if (!(value instanceof RuleValue.NumberValue days) || !days.isWholeNumber() || days.getValue() < 0) {
                    throw new InvalidRuleException("Operator " + operator.getCode()
                            + " requires a non-negative whole number of days, got " + value, path, rule.getId());
                }
            }
            default -> throw new IllegalStateException("Unhandled arity " + operator.getArity());
        }
    }

    private RuleValue.ArrayValue asArray(Operator operator, RuleValue value, String path, String ruleId) {
        if (!(value instanceof RuleValue.ArrayValue array)) {
            throw new InvalidRuleException("Operator " + operator.getCode() + " requires a list value", path, ruleId);
        }
        return array;
    }

    private void checkScalar(DataType dataType, RuleValue value, String path, String ruleId) {
        boolean matches = switch (dataType) {
            case NUMBER -> value instanceof RuleValue.NumberValue number && Double.isFinite(number.getValue());
            case STRING -> value instanceof RuleValue.StringValue text && text.getValue() != null;
            case DATE -> value instanceof RuleValue.DateValue date && date.getValue() != null;
            case BOOLEAN -> value instanceof RuleValue.BoolValue;
            // array fields compare against their elements
            case ARRAY -> value instanceof RuleValue.StringValue text && text.getValue() != null
                    || value instanceof RuleValue.NumberValue
                    || value instanceof RuleValue.BoolValue;
        };
        if (!matches) {
            throw new InvalidRuleException("Expected a single " + dataType.getCode() + " value but got " + value,
                    path, ruleId);
        }
    }

    private void checkOptions(FieldDefinition field, RuleValue value, String path, String ruleId) {
        if (value instanceof RuleValue.ArrayValue array) {
            for (RuleValue item : array.getValues()) {
                checkOptions(field, item, path, ruleId);
            }
            return;
        }
        Object option = value.toJson();
        if (!field.getOptions().contains(option)) {
            throw new InvalidRuleException("Value " + value + " is not one of " + field.getOptions()
                    + " for field " + field.getName(), path, ruleId);
        }
    }

    private void checkRange(RuleValue.ArrayValue range, String path, String ruleId) {
        RuleValue low = range.get(0);
        RuleValue high = range.get(1);
        boolean ordered;
        if (low instanceof RuleValue.NumberValue l && high instanceof RuleValue.NumberValue h) {
            ordered = l.getValue() <= h.getValue();
        } else if (low instanceof RuleValue.DateValue l && high instanceof RuleValue.DateValue h) {
            ordered = !l.getValue().isAfter(h.getValue());
        } else if (low instanceof RuleValue.StringValue l && high instanceof RuleValue.StringValue h) {
            ordered = l.getValue().compareTo(h.getValue()) <= 0;
        } else {
            throw new InvalidRuleException("between bounds must have the same type", path, ruleId);
        }
        if (!ordered) {
            throw new InvalidRuleException("between requires low <= high, got " + range, path, ruleId);
        }
    }
}
