package com.minicrm.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Audience count and sample taken from the same query snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AudiencePreview {

    private long count;
    private List<CustomerSummary> sampleCustomers;
    private Instant computedAt;
}
