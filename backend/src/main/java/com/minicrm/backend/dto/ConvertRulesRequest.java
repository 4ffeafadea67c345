package com.minicrm.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Natural language audience description")
public class ConvertRulesRequest {

    @NotBlank
    @Size(max = 1000)
    @Schema(description = "Audience in plain words", example = "customers who spent over 5000 and visited less than 3 times")
    private String query;
}
