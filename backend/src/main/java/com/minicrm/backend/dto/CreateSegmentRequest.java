package com.minicrm.backend.dto;

import com.minicrm.backend.model.RuleConfidence;
import com.minicrm.backend.model.RuleGroupDefinition;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to create a segment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to create a customer segment")
public class CreateSegmentRequest {

    @NotBlank
    @Size(min = 2, max = 100)
    @Schema(description = "Segment name", example = "High value customers")
    private String name;

    @Size(max = 500)
    @Schema(description = "Free text description")
    private String description;

    @NotEmpty
    @Schema(description = "Top-level rule groups, combined with AND")
    private List<RuleGroupDefinition> ruleGroups;

    @Size(max = 1000)
    @Schema(description = "Natural language query the rules were generated from", example = "customers who spent over 1000")
    private String naturalLanguageQuery;

    @Schema(description = "Confidence reported when the rules came from the AI converter")
    private RuleConfidence ruleConfidence;

    @Schema(description = "Labels for organising segments")
    private List<String> tags;
}
