package com.minicrm.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@Schema(description = "Error details")
public class ErrorResponse {

    @Schema(description = "Error code", example = "INVALID_RULE")
    private String error;

    @Schema(description = "Human readable message")
    private String message;

    @Schema(description = "Location of the offending rule", example = "ruleGroups[0].rules[2]")
    private String path;

    @Schema(description = "Client supplied id of the offending rule")
    private String ruleId;
}
