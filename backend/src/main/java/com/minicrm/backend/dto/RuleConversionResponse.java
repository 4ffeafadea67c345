package com.minicrm.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.minicrm.backend.model.RuleConfidence;
import com.minicrm.backend.model.RuleGroupDefinition;
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
@Schema(description = "Result of converting natural language to segment rules")
public class RuleConversionResponse {

    @Schema(description = "SUCCESS, FALLBACK or FAILURE")
    private String status;

    @Schema(description = "HIGH when the language model produced the rules, LOW for fallback rules")
    private RuleConfidence confidence;

    private RuleGroupDefinition ruleGroup;

    @Schema(description = "Plain description of the audience")
    private String description;

    @Schema(description = "Why the language model result was not used")
    private String reason;

    @Schema(description = "Version of the fallback table used")
    private String fallbackVersion;
}
