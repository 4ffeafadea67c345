package com.minicrm.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for campaign message suggestions")
public class MessageSuggestionRequest {

    @Schema(description = "promotional, transactional or nurture", example = "promotional")
    private String campaignType;

    @Size(max = 1000)
    @Schema(description = "Who the message is for", example = "high value customers who have not ordered recently")
    private String audienceDescription;

    @Size(max = 1000)
    @Schema(description = "Extra context such as an offer or a season")
    private String context;
}
