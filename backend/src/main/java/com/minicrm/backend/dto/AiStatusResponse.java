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
@Schema(description = "Availability of the language model features")
public class AiStatusResponse {

    @Schema(description = "Whether a language model is configured")
    private boolean available;

    @Schema(description = "Version of the fallback rule table used when the model is not available")
    private String fallbackVersion;

    @Schema(description = "What callers should expect while the model is not available")
    private List<String> limitations;
}
