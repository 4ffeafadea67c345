package com.minicrm.backend.dto;

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
@Schema(description = "Audience preview")
public class PreviewResponse {

    @Schema(description = "Number of matching customers", example = "42")
    private long count;

    @Schema(description = "First matching customers ordered by customerId")
    private List<CustomerSummary> sampleCustomers;

    @Schema(description = "Rules that were evaluated")
    private List<RuleGroupDefinition> rules;

    @Schema(description = "Evaluation time")
    private Instant previewedAt;
}
