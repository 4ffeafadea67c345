package com.minicrm.backend.dto;

import com.minicrm.backend.model.RuleGroupDefinition;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Rules to preview without saving a segment")
public class PreviewRequest {

    @NotEmpty
    @Schema(description = "Top-level rule groups, combined with AND")
    private List<RuleGroupDefinition> ruleGroups;
}
