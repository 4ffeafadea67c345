package com.minicrm.backend.rules;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.minicrm.backend.rules.Operator.*;

/**
 * Registry of the customer fields that segment rules may reference.
 * <p>
 * The catalog is the single source of truth for field metadata: the field options
 * endpoint renders it and {@link RuleValidator} checks rule trees against it.
 * Instances are immutable and safe to share between threads.
 */
public class FieldCatalog {

    private static final Set<Operator> COMPARISONS = EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN,
            GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, BETWEEN);
    private static final Set<Operator> TEXT = EnumSet.of(EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS,
            STARTS_WITH, ENDS_WITH, IS_EMPTY, IS_NOT_EMPTY);
    private static final Set<Operator> CHOICE = EnumSet.of(EQUALS, NOT_EQUALS, IN, NOT_IN);
    private static final Set<Operator> PAST_DATE = EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN,
            GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, BETWEEN, LAST_N_DAYS, IS_EMPTY, IS_NOT_EMPTY);
    private static final Set<Operator> FLAG = EnumSet.of(IS_TRUE, IS_FALSE);

    private final Map<String, FieldDefinition> fields;

    public FieldCatalog(List<FieldDefinition> definitions) {
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        for (FieldDefinition definition : definitions) {
            for (Operator operator : definition.getOperators()) {
                if (!definition.getDataType().supports(operator)) {
                    throw new IllegalArgumentException("Field " + definition.getName() + " declares operator "
                            + operator.getCode() + " which is not valid for type "
                            + definition.getDataType().getCode());
                }
            }
            if (byName.put(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate field: " + definition.getName());
            }
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public boolean isValidField(String name) {
        return name != null && fields.containsKey(name);
    }

    /**
     * @throws UnknownFieldException if the field is not registered
     */
    public FieldDefinition field(String name) {
        FieldDefinition definition = name != null ? fields.get(name) : null;
        if (definition == null) {
            throw new UnknownFieldException(name);
        }
        return definition;
    }

    public Set<Operator> allowedOperators(String name) {
        return field(name).getOperators();
    }

    public DataType dataTypeOf(String name) {
        return field(name).getDataType();
    }

    public List<FieldDefinition> fields() {
        return List.copyOf(fields.values());
    }

    /**
     * Fields available to customer segmentation.
     */
    public static FieldCatalog standard() {
        return new FieldCatalog(List.of(
                FieldDefinition.stored("name", "Name", DataType.STRING).operators(TEXT).build(),
                FieldDefinition.stored("email", "Email", DataType.STRING).operators(TEXT).build(),
                FieldDefinition.stored("city", "City", DataType.STRING)
                        .path("location.city")
                        .operators(TEXT).operator(IN).operator(NOT_IN)
                        .build(),
                FieldDefinition.stored("status", "Status", DataType.STRING)
                        .operators(CHOICE)
                        .option("active").option("inactive").option("banned")
                        .build(),
                FieldDefinition.stored("channel", "Preferred Channel", DataType.STRING)
                        .path("preferences.channel")
                        .operators(CHOICE)
                        .option("email").option("sms").option("both")
                        .build(),
                FieldDefinition.stored("churnRisk", "Churn Risk", DataType.STRING)
                        .path("aiInsights.churnRisk")
                        .operators(CHOICE)
                        .option("low").option("medium").option("high")
                        .build(),
                FieldDefinition.stored("preferredCategory", "Preferred Category", DataType.STRING)
                        .operators(EnumSet.of(EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, IN, NOT_IN,
                                IS_EMPTY, IS_NOT_EMPTY))
                        .build(),
                FieldDefinition.stored("totalSpent", "Total Spent", DataType.NUMBER)
                        .operators(COMPARISONS).operator(IN).operator(NOT_IN)
                        .build(),
                FieldDefinition.stored("totalVisits", "Total Visits", DataType.NUMBER)
                        .operators(COMPARISONS)
                        .build(),
                FieldDefinition.stored("lastVisit", "Last Visit", DataType.DATE).operators(PAST_DATE).build(),
                FieldDefinition.stored("registrationDate", "Customer Since", DataType.DATE)
                        .operators(PAST_DATE)
                        .build(),
                FieldDefinition.stored("subscriptionExpiresAt", "Subscription Expiry", DataType.DATE)
                        .operators(EnumSet.of(GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL,
                                BETWEEN, NEXT_N_DAYS, IS_EMPTY, IS_NOT_EMPTY))
                        .build(),
                FieldDefinition.stored("emailOptIn", "Email Opt-in", DataType.BOOLEAN)
                        .path("preferences.emailOptIn")
                        .operators(FLAG)
                        .build(),
                FieldDefinition.stored("isActive", "Active Account", DataType.BOOLEAN).operators(FLAG).build(),
                FieldDefinition.stored("tags", "Tags", DataType.ARRAY)
                        .operators(DataType.ARRAY.getOperators())
                        .build(),
                FieldDefinition.derived(DerivedField.ORDER_COUNT, "Number of Orders", DataType.NUMBER)
                        .operators(COMPARISONS)
                        .build(),
                FieldDefinition.derived(DerivedField.AVERAGE_ORDER_VALUE, "Average Order Value", DataType.NUMBER)
                        .operators(COMPARISONS)
                        .build(),
                FieldDefinition.derived(DerivedField.LAST_ORDER_DATE, "Last Order Date", DataType.DATE)
                        .operators(EnumSet.of(GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL,
                                BETWEEN, LAST_N_DAYS, IS_EMPTY, IS_NOT_EMPTY))
                        .build(),
                FieldDefinition.derived(DerivedField.LAST_ORDER_DAYS_AGO, "Days Since Last Order", DataType.NUMBER)
                        .operators(COMPARISONS)
                        .build(),
                FieldDefinition.derived(DerivedField.DAYS_SINCE_LAST_VISIT, "Days Since Last Visit",
                        DataType.NUMBER)
                        .operators(COMPARISONS)
                        .build(),
                FieldDefinition.derived(DerivedField.REGISTRATION_DAYS_AGO, "Days Since Registration",
                        DataType.NUMBER)
                        .operators(COMPARISONS)
                        .build()));
    }
}
