package com.minicrm.backend.dto;

import com.minicrm.backend.model.RuleConfidence;
import com.minicrm.backend.model.RuleGroupDefinition;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of a segment. Null fields are left unchanged; new rule groups trigger
 * a recount of the audience.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to update a customer segment")
public class UpdateSegmentRequest {

    @Size(min = 2, max = 100)
    @Schema(description = "Segment name")
    private String name;

    @Size(max = 500)
    @Schema(description = "Free text description")
    private String description;

    @Size(min = 1)
    @Schema(description = "Replacement rule groups")
    private List<RuleGroupDefinition> ruleGroups;

    @Size(max = 1000)
    @Schema(description = "Natural language query the rules were generated from")
    private String naturalLanguageQuery;

    @Schema(description = "Confidence reported when the rules came from the AI converter")
    private RuleConfidence ruleConfidence;

    @Schema(description = "Whether the segment is active")
    private Boolean active;

    @Schema(description = "Labels for organising segments")
    private List<String> tags;
}
