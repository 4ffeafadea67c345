package com.minicrm.backend.rules;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One entry of the {@link FieldCatalog}.
 */
@Value
@Builder
public class FieldDefinition {

    String name;
    String label;
    DataType dataType;

    @Singular
    Set<Operator> operators;

    /**
     * Closed value set, empty when the field accepts free values.
     */
    @Singular
    List<String> options;

    /**
     * Document path on the customer record; derived fields use their own name.
     */
    String path;

    /**
     * Null for stored fields.
     */
    DerivedField derivedField;

    public boolean isDerived() {
        return derivedField != null;
    }

    public boolean hasOptions() {
        return !options.isEmpty();
    }

    public boolean supports(Operator operator) {
        return operators.contains(operator);
    }

    public static FieldDefinitionBuilder stored(String name, String label, DataType dataType) {
        return builder().name(name).label(label).dataType(dataType).path(name);
    }

    public static FieldDefinitionBuilder derived(DerivedField derivedField, String label, DataType dataType) {
        return builder()
                .name(derivedField.getFieldName())
                .label(label)
                .dataType(dataType)
                .path(derivedField.getFieldName())
                .derivedField(derivedField);
    }
}
