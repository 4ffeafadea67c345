package com.minicrm.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Field catalog as exposed to the rule builder UI.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Fields and operators available to segment rules")
public class FieldOptionsResponse {

    private List<FieldOption> fields;

    @Schema(description = "Operators by data type")
    private Map<String, List<OperatorOption>> operators;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldOption {

        @Schema(example = "totalSpent")
        private String name;

        @Schema(example = "Total Spent")
        private String label;

        @Schema(example = "number")
        private String type;

        private List<OperatorOption> operators;

        @Schema(description = "Allowed values for closed value sets")
        private List<String> options;

        @Schema(description = "Computed from order history or dates at query time")
        private boolean derived;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperatorOption {

        @Schema(example = "greater_than")
        private String value;

        @Schema(example = "Greater than")
        private String label;
    }
}
