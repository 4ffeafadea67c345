package com.minicrm.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Segment document: a named audience definition owned by a user.
 * {@code audienceSize} is cached and only as fresh as {@code lastCalculated}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "segments")
public class Segment {

    @Id
    private String id;

    private String name;

    private String description;

    /** OAuth subject of the owner. */
    @Indexed
    private String createdBy;

    /** Top-level groups, combined with AND. */
    @Builder.Default
    private List<RuleGroupDefinition> ruleGroups = new ArrayList<>();

    private String naturalLanguageQuery;

    /** Null when the rules were written by hand. */
    private RuleConfidence ruleConfidence;

    @Builder.Default
    private long audienceSize = 0;

    private Instant lastCalculated;

    @Field("isActive")
    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
