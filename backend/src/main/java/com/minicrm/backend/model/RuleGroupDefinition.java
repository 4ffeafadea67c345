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

import java.util.List;

/**
 * AND/OR group. Children may be listed under {@code rules} (rules or nested groups)
 * and under {@code groups} (nested groups only); {@code rules} entries come first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
@Schema(description = "Group of rules combined with AND or OR")
public class RuleGroupDefinition implements RuleNodeDefinition {

    @Schema(description = "Client supplied identifier", example = "group-1")
    private String id;

    @Schema(description = "AND or OR, defaults to AND", example = "AND")
    private String logic;

    private List<RuleNodeDefinition> rules;

    private List<RuleGroupDefinition> groups;
}
