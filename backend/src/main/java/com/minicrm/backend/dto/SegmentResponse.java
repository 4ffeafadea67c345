package com.minicrm.backend.dto;

import com.minicrm.backend.model.RuleConfidence;
import com.minicrm.backend.model.RuleGroupDefinition;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Segment details response")
public class SegmentResponse {

    @Schema(description = "Segment ID")
    private String id;

    @Schema(description = "Segment name")
    private String name;

    @Schema(description = "Description")
    private String description;

    @Schema(description = "Owner")
    private String createdBy;

    @Schema(description = "Top-level rule groups, combined with AND")
    private List<RuleGroupDefinition> ruleGroups;

    @Schema(description = "Natural language query the rules were generated from")
    private String naturalLanguageQuery;

    @Schema(description = "AI confidence, absent for hand-written rules")
    private RuleConfidence ruleConfidence;

    @Schema(description = "Audience size at lastCalculated")
    private long audienceSize;

    @Schema(description = "When the audience size was last computed")
    private Instant lastCalculated;

    @Schema(description = "Whether the segment is active")
    private boolean active;

    @Schema(description = "Labels")
    private List<String> tags;

    @Schema(description = "Creation timestamp")
    private Instant createdAt;

    @Schema(description = "Last update timestamp")
    private Instant updatedAt;
}
