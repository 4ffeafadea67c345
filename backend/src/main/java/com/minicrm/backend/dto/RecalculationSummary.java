package com.minicrm.backend.dto;

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
@Schema(description = "Outcome of recalculating all active segments")
public class RecalculationSummary {

    private int total;
    private int updated;
    private int failed;

    @Schema(description = "Segments whose recalculation failed")
    private List<String> failedSegmentIds;

    private Instant completedAt;
}
