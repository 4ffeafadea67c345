package com.minicrm.backend.rules;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles validated rule trees into MongoDB aggregation stages over {@code customers}.
 * <p>
 * Top-level conjuncts that only touch stored fields are matched before the order join so
 * the join runs on as few customers as possible. Derived fields are materialized with one
 * {@code $addFields} stage holding exactly the referenced fields.
 */
@Component
public class QueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    private static final String REGEX_SPECIALS = "\\.*+?^${}()|[]/";

    private final FieldCatalog catalog;
    private final RuleValidator validator;
    private final Clock clock;

    public QueryCompiler(FieldCatalog catalog, RuleValidator validator, Clock clock) {
        this.catalog = catalog;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Validate and compile segment rule groups. The groups are combined with AND.
     *
     * @throws RuleValidationException if any rule does not fit the catalog
     */
    public CompiledQuery compile(List<RuleGroup> groups) {
        validator.validateAll(groups);
        Instant now = clock.instant();

        List<Document> storedConjuncts = new ArrayList<>();
        List<Document> derivedConjuncts = new ArrayList<>();
        Set<DerivedField> derived = EnumSet.noneOf(DerivedField.class);

        for (RuleGroup group : groups) {
            List<RuleNode> conjuncts = group.getLogic() == Logic.AND ? group.getChildren() : List.of(group);
            for (RuleNode conjunct : conjuncts) {
                Document filter = translate(conjunct, now);
                if (filter.isEmpty()) {
                    continue;
                }
                Set<DerivedField> referenced = derivedFieldsOf(conjunct);
                if (referenced.isEmpty()) {
                    storedConjuncts.add(filter);
                } else {
                    derivedConjuncts.add(filter);
                    derived.addAll(referenced);
                }
            }
        }

        List<Document> stages = new ArrayList<>();
        if (!storedConjuncts.isEmpty()) {
            stages.add(new Document("$match", and(storedConjuncts)));
        }
        if (!derived.isEmpty()) {
            if (derived.stream().anyMatch(DerivedField::requiresOrders)) {
                stages.add(DerivedField.orderLookupStage());
            }
            Document fields = new Document();
            for (DerivedField field : derived) {
                fields.append(field.getFieldName(), field.expression(now));
            }
            stages.add(new Document("$addFields", fields));
        }
        if (!derivedConjuncts.isEmpty()) {
            stages.add(new Document("$match", and(derivedConjuncts)));
        }

        CompiledQuery compiled = new CompiledQuery(stages, now, derived);
        log.debug("Compiled {} rule group(s) into {} stage(s)", groups.size(), stages.size());
        return compiled;
    }

    /**
     * Translate a single node into a match filter. An empty document matches everything.
     */
    public Document translate(RuleNode node, Instant now) {
        return node.accept(new RuleNodeVisitor<Document>() {
            @Override
            public Document visitRule(Rule rule) {
                return translateRule(rule, now);
            }

            @Override
            public Document visitGroup(RuleGroup group) {
                return translateGroup(group, now);
            }
        });
    }

    private Document translateGroup(RuleGroup group, Instant now) {
        List<Document> parts = new ArrayList<>();
        for (RuleNode child : group.getChildren()) {
            Document part = translate(child, now);
            if (part.isEmpty()) {
                if (group.getLogic() == Logic.OR) {
                    return new Document();
                }
                continue;
            }
            parts.add(part);
        }
        if (parts.isEmpty()) {
            return new Document();
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Document(group.getLogic() == Logic.AND ? "$and" : "$or", parts);
    }

    private Document translateRule(Rule rule, Instant now) {
        FieldDefinition field = catalog.field(rule.getField());
        String path = field.getPath();
        DataType type = rule.getDataType();
        RuleValue value = rule.getValue();

        return switch (rule.getOperator()) {
            case EQUALS -> type == DataType.DATE
                    ? sameDay(path, date(value))
                    : condition(path, "$eq", value.toBson());
            case NOT_EQUALS -> type == DataType.DATE
                    ? new Document("$and", List.of(
                            condition(path, "$ne", null),
                            new Document("$nor", List.of(sameDay(path, date(value))))))
                    : condition(path, "$nin", withNull(List.of(value.toBson())));
            case GREATER_THAN -> condition(path, "$gt", value.toBson());
            case GREATER_THAN_OR_EQUAL -> condition(path, "$gte", value.toBson());
            case LESS_THAN -> condition(path, "$lt", value.toBson());
            case LESS_THAN_OR_EQUAL -> condition(path, "$lte", value.toBson());
            case CONTAINS -> contains(path, type, value);
            case NOT_CONTAINS -> new Document("$nor", List.of(contains(path, type, value)));
            case STARTS_WITH -> regex(path, "^" + escapeRegex(text(value)));
            case ENDS_WITH -> regex(path, escapeRegex(text(value)) + "$");
            case IN -> condition(path, "$in", value.toBson());
            case NOT_IN -> condition(path, "$nin", withNull((List<?>) value.toBson()));
            case BETWEEN -> {
                RuleValue.ArrayValue range = (RuleValue.ArrayValue) value;
                yield new Document(path, new Document()
                        .append("$gte", range.get(0).toBson())
                        .append("$lte", range.get(1).toBson()));
            }
            case LAST_N_DAYS -> new Document(path, new Document()
                    .append("$gte", Date.from(now.minus(days(value))))
                    .append("$lte", Date.from(now)));
            case NEXT_N_DAYS -> new Document(path, new Document()
                    .append("$gte", Date.from(now))
                    .append("$lte", Date.from(now.plus(days(value)))));
            case IS_EMPTY -> isEmpty(path, type);
            case IS_NOT_EMPTY -> isNotEmpty(path, type);
            case IS_TRUE -> condition(path, "$eq", true);
            case IS_FALSE -> condition(path, "$eq", false);
        };
    }

    private Document contains(String path, DataType type, RuleValue value) {
        if (type == DataType.ARRAY) {
            // element equality
            return condition(path, "$eq", value.toBson());
        }
        return regex(path, escapeRegex(text(value)));
    }

    private Document isEmpty(String path, DataType type) {
        return switch (type) {
            case STRING -> new Document("$or", List.of(
                    condition(path, "$eq", null),
                    condition(path, "$eq", "")));
            case ARRAY -> new Document("$or", List.of(
                    condition(path, "$eq", null),
                    condition(path, "$size", 0)));
            default -> condition(path, "$eq", null);
        };
    }

    private Document isNotEmpty(String path, DataType type) {
        return switch (type) {
            case STRING -> condition(path, "$nin", withNull(List.of("")));
            case ARRAY -> condition(path + ".0", "$exists", true);
            default -> condition(path, "$ne", null);
        };
    }

    private static Document sameDay(String path, Instant instant) {
        Instant start = instant.truncatedTo(ChronoUnit.DAYS);
        return new Document(path, new Document()
                .append("$gte", Date.from(start))
                .append("$lt", Date.from(start.plus(1, ChronoUnit.DAYS))));
    }

    private static Document regex(String path, String pattern) {
        return new Document(path, new Document("$regex", pattern).append("$options", "i"));
    }

    private static Document condition(String path, String operator, Object operand) {
        return new Document(path, new Document(operator, operand));
    }

    private static Document and(List<Document> filters) {
        return filters.size() == 1 ? filters.get(0) : new Document("$and", filters);
    }

    /**
     * {@code values} preceded by null, so that {@code $nin} also rejects missing fields.
     */
    private static List<Object> withNull(List<?> values) {
        List<Object> operands = new ArrayList<>(values.size() + 1);
        operands.add(null);
        operands.addAll(values);
        return operands;
    }

    private static Instant date(RuleValue value) {
        return ((RuleValue.DateValue) value).getValue();
    }

    private static String text(RuleValue value) {
        return String.valueOf(value.toJson());
    }

    private static Duration days(RuleValue value) {
        return Duration.ofDays((long) ((RuleValue.NumberValue) value).getValue());
    }

    static String escapeRegex(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (char c : text.toCharArray()) {
            if (REGEX_SPECIALS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private Set<DerivedField> derivedFieldsOf(RuleNode node) {
        Set<DerivedField> found = EnumSet.noneOf(DerivedField.class);
        node.accept(new RuleNodeVisitor<Void>() {
            @Override
            public Void visitRule(Rule rule) {
                FieldDefinition field = catalog.field(rule.getField());
                if (field.isDerived()) {
                    found.add(field.getDerivedField());
                }
                return null;
            }

            @Override
            public Void visitGroup(RuleGroup group) {
                group.getChildren().forEach(child -> child.accept(this));
                return null;
            }
        });
        return found;
    }
}
