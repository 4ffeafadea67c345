package com.minicrm.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Campaign message suggestions")
public class MessageSuggestionResponse {

    private String campaignType;

    private List<MessageSuggestion> suggestions;

    @Schema(description = "True when the built-in messages were returned instead of generated ones")
    private boolean fallback;
}
