package com.minicrm.backend.rules;

import com.minicrm.backend.model.RuleDefinition;
import com.minicrm.backend.model.RuleGroupDefinition;
import com.minicrm.backend.model.RuleNodeDefinition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Converts rule definitions received over the API (or read back from a segment) into the
 * typed rule tree, and back.
 * <p>
 * Mapping checks structure only: logic, operator and data type codes, value shape per
 * operator arity, and nesting depth. Catalog checks happen in {@link RuleValidator}.
 */
@Component
public class RuleTreeMapper {

    public static final int MAX_DEPTH = 10;

    public List<RuleGroup> toRuleGroups(List<RuleGroupDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new InvalidRuleException("At least one rule group is required", "ruleGroups", null);
        }
        List<RuleGroup> groups = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            groups.add(toRuleGroup(definitions.get(i), "ruleGroups[" + i + "]"));
        }
        return groups;
    }

    /**
     * @param path location of {@code definition} used in error messages
     * @throws InvalidRuleException if the definition is malformed
     */
    public RuleGroup toRuleGroup(RuleGroupDefinition definition, String path) {
        return mapGroup(definition, path, 1);
    }

    private RuleGroup mapGroup(RuleGroupDefinition definition, String path, int depth) {
        if (definition == null) {
            throw new InvalidRuleException("Rule group is missing", path, null);
        }
        if (depth > MAX_DEPTH) {
            throw new InvalidRuleException("Rule groups may be nested at most " + MAX_DEPTH + " levels deep",
                    path, definition.getId());
        }
        Logic logic = Logic.AND;
        if (definition.getLogic() != null) {
            logic = Logic.fromCode(definition.getLogic())
                    .orElseThrow(() -> new InvalidRuleException(
                            "Unknown logic '" + definition.getLogic() + "', expected AND or OR",
                            path, definition.getId()));
        }

        List<RuleNode> children = new ArrayList<>();
        List<RuleNodeDefinition> rules = definition.getRules();
        if (rules != null) {
            for (int i = 0; i < rules.size(); i++) {
                RuleNodeDefinition child = rules.get(i);
                String childPath = path + ".rules[" + i + "]";
                if (child instanceof RuleGroupDefinition nested) {
                    children.add(mapGroup(nested, childPath, depth + 1));
                } else if (child instanceof RuleDefinition rule) {
                    children.add(mapRule(rule, childPath));
                } else {
                    throw new InvalidRuleException("Rule entry is missing", childPath, null);
                }
            }
        }
        List<RuleGroupDefinition> groups = definition.getGroups();
        if (groups != null) {
            for (int i = 0; i < groups.size(); i++) {
                children.add(mapGroup(groups.get(i), path + ".groups[" + i + "]", depth + 1));
            }
        }
        return new RuleGroup(definition.getId(), logic, children);
    }

    private Rule mapRule(RuleDefinition definition, String path) {
        String id = definition.getId();
        if (definition.getField() == null || definition.getField().isBlank()) {
            throw new InvalidRuleException("Rule field is required", path, id);
        }
        Operator operator = Operator.fromCode(definition.getOperator())
                .orElseThrow(() -> new InvalidRuleException(
                        "Unknown operator '" + definition.getOperator() + "'", path, id));
        if (definition.getDataType() == null) {
            throw new InvalidRuleException("Rule dataType is required", path, id);
        }
        DataType dataType = DataType.fromCode(definition.getDataType())
                .orElseThrow(() -> new InvalidRuleException(
                        "Unknown data type '" + definition.getDataType() + "'", path, id));

        return Rule.builder()
                .id(id)
                .field(definition.getField())
                .operator(operator)
                .dataType(dataType)
                .value(mapValue(operator, dataType, definition.getValue(), path, id))
                .build();
    }

    private RuleValue mapValue(Operator operator, DataType dataType, Object raw, String path, String id) {
        return switch (operator.getArity()) {
            case NONE -> null;
            case SINGLE -> {
                if (raw == null) {
                    throw new InvalidRuleException("Operator " + operator.getCode() + " requires a value", path, id);
                }
                yield scalar(dataType, raw, path, id);
            }
            case LIST -> {
                List<?> items = asList(raw, operator, path, id);
                if (items.isEmpty()) {
                    throw new InvalidRuleException("Operator " + operator.getCode() + " requires at least one value",
                            path, id);
                }
                yield list(dataType, items, path, id);
            }
            case RANGE -> {
                List<?> items = asList(raw, operator, path, id);
                if (items.size() != 2) {
                    throw new InvalidRuleException("Operator between requires exactly two values [low, high]",
                            path, id);
                }
                yield list(dataType, items, path, id);
            }
            case DAY_COUNT -> dayCount(operator, raw, path, id);
        };
    }

    private RuleValue dayCount(Operator operator, Object raw, String path, String id) {
        if (!(raw instanceof Number number)) {
            throw new InvalidRuleException("Operator " + operator.getCode()
                    + " requires a whole number of days", path, id);
        }
        double days = number.doubleValue();
        if (days < 0 || days != Math.rint(days) || Double.isInfinite(days)) {
            throw new InvalidRuleException("Operator " + operator.getCode()
                    + " requires a non-negative whole number of days, got " + raw, path, id);
        }
        return RuleValue.number(days);
    }

    private List<?> asList(Object raw, Operator operator, String path, String id) {
        if (!(raw instanceof List<?> items)) {
            throw new InvalidRuleException("Operator " + operator.getCode() + " requires a list value", path, id);
        }
        return items;
    }

    private RuleValue list(DataType dataType, List<?> items, String path, String id) {
        List<RuleValue> values = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item == null) {
                throw new InvalidRuleException("List values must not be null", path, id);
            }
            values.add(scalar(dataType, item, path, id));
        }
        return RuleValue.array(values);
    }

    private RuleValue scalar(DataType dataType, Object raw, String path, String id) {
        if (raw instanceof List || raw instanceof Map) {
            throw new InvalidRuleException("Expected a single " + dataType.getCode() + " value", path, id);
        }
        return switch (dataType) {
            case NUMBER -> number(raw, path, id);
            case STRING -> {
                if (!(raw instanceof String text)) {
                    throw new InvalidRuleException("Expected a string but got " + describe(raw), path, id);
                }
                yield RuleValue.string(text);
            }
            case DATE -> RuleValue.date(parseDate(raw, path, id));
            case BOOLEAN -> {
                if (!(raw instanceof Boolean flag)) {
                    throw new InvalidRuleException("Expected a boolean but got " + describe(raw), path, id);
                }
                yield RuleValue.bool(flag);
            }
            // array fields compare against their elements
            case ARRAY -> {
                if (raw instanceof String text) {
                    yield RuleValue.string(text);
                }
                if (raw instanceof Boolean flag) {
                    yield RuleValue.bool(flag);
                }
                yield number(raw, path, id);
            }
        };
    }

    private RuleValue number(Object raw, String path, String id) {
        if (!(raw instanceof Number number)) {
            throw new InvalidRuleException("Expected a number but got " + describe(raw), path, id);
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidRuleException("Number value must be finite", path, id);
        }
        return RuleValue.number(value);
    }

    /**
     * Accepts an ISO-8601 instant, an offset date-time or a plain {@code yyyy-MM-dd} date (UTC midnight).
     */
    private Instant parseDate(Object raw, String path, String id) {
        if (raw instanceof Date date) {
            return date.toInstant();
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (!(raw instanceof String text)) {
            throw new InvalidRuleException("Expected a date but got " + describe(raw), path, id);
        }
        String trimmed = text.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidRuleException("Invalid date '" + text + "', expected ISO-8601", path, id);
        }
    }

    private static String describe(Object raw) {
        return raw instanceof String ? "string \"" + raw + "\"" : raw.getClass().getSimpleName() + " " + raw;
    }

    /**
     * Wire form of a typed group. Children are written in order under {@code rules}.
     */
    public RuleGroupDefinition toDefinition(RuleGroup group) {
        List<RuleNodeDefinition> rules = new ArrayList<>(group.getChildren().size());
        for (RuleNode child : group.getChildren()) {
            rules.add(child.accept(new RuleNodeVisitor<RuleNodeDefinition>() {
                @Override
                public RuleNodeDefinition visitRule(Rule rule) {
                    return toDefinition(rule);
                }

                @Override
                public RuleNodeDefinition visitGroup(RuleGroup nested) {
                    return toDefinition(nested);
                }
            }));
        }
        return RuleGroupDefinition.builder()
                .id(group.getId())
                .logic(group.getLogic().name())
                .rules(rules)
                .build();
    }

    public List<RuleGroupDefinition> toDefinitions(List<RuleGroup> groups) {
        List<RuleGroupDefinition> definitions = new ArrayList<>(groups.size());
        for (RuleGroup group : groups) {
            definitions.add(toDefinition(group));
        }
        return definitions;
    }

    public RuleDefinition toDefinition(Rule rule) {
        return RuleDefinition.builder()
                .id(rule.getId())
                .field(rule.getField())
                .operator(rule.getOperator().getCode())
                .value(rule.getValue() != null ? rule.getValue().toJson() : null)
                .dataType(rule.getDataType().getCode())
                .build();
    }
}
