package com.minicrm.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Minimal customer projection returned by audience queries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Customer in a segment audience")
public class CustomerSummary {

    @Schema(description = "Business customer ID", example = "CUST001")
    private String customerId;

    @Schema(description = "Customer name")
    private String name;

    @Schema(description = "Customer email")
    private String email;

    @Schema(description = "Total amount spent")
    private Double totalSpent;

    @Schema(description = "Total visits")
    private Integer totalVisits;

    @Schema(description = "Last visit")
    private Instant lastVisit;
}
