package com.minicrm.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
@Schema(description = "Single predicate on a customer field")
public class RuleDefinition implements RuleNodeDefinition {

    @Schema(description = "Client supplied identifier", example = "rule-1")
    private String id;

    @Schema(description = "Catalog field name", example = "totalSpent")
    private String field;

    @Schema(description = "Operator code", example = "greater_than")
    private String operator;

    @Schema(description = "Operand: scalar, list for in/not_in, [low, high] for between, day count for last_n_days")
    private Object value;

    @Schema(description = "Declared data type of the field", example = "number")
    private String dataType;
}
