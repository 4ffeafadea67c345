package com.minicrm.backend.controller;

import com.minicrm.backend.dto.AiStatusResponse;
import com.minicrm.backend.dto.ConvertRulesRequest;
import com.minicrm.backend.dto.MessageSuggestionRequest;
import com.minicrm.backend.dto.MessageSuggestionResponse;
import com.minicrm.backend.dto.RuleConversionResponse;
import com.minicrm.backend.rules.FallbackRuleTable;
import com.minicrm.backend.service.LanguageModelService;
import com.minicrm.backend.service.MessageSuggestionService;
import com.minicrm.backend.service.NaturalLanguageRuleService;
import com.minicrm.backend.service.RuleConversionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ai")
@Tag(name = "AI", description = "Natural language segmentation and copywriting")
public class AiController {

    private final NaturalLanguageRuleService naturalLanguageRuleService;
    private final MessageSuggestionService messageSuggestionService;
    private final LanguageModelService languageModelService;
    private final FallbackRuleTable fallbackRuleTable;

    public AiController(NaturalLanguageRuleService naturalLanguageRuleService,
            MessageSuggestionService messageSuggestionService,
            LanguageModelService languageModelService,
            FallbackRuleTable fallbackRuleTable) {
        this.naturalLanguageRuleService = naturalLanguageRuleService;
        this.messageSuggestionService = messageSuggestionService;
        this.languageModelService = languageModelService;
        this.fallbackRuleTable = fallbackRuleTable;
    }

    @GetMapping("/status")
    @Operation(summary = "Get AI status",
            description = "Whether the language model is configured; when it is not, conversions return fallback rules")
    public ResponseEntity<AiStatusResponse> getStatus() {
        boolean available = languageModelService.isAvailable();
        return ResponseEntity.ok(AiStatusResponse.builder()
                .available(available)
                .fallbackVersion(fallbackRuleTable.getVersion())
                .limitations(available ? List.of() : List.of(
                        "Language model API key not configured",
                        "Natural language conversion returns LOW confidence fallback rules",
                        "Message suggestions use built-in templates"))
                .build());
    }

    @PostMapping("/segment-rules")
    @Operation(summary = "Convert natural language to rules",
            description = "Returns HIGH confidence rules from the language model or LOW confidence fallback rules")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rules generated"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "422", description = "No rules could be derived")
    })
    public ResponseEntity<RuleConversionResponse> convertToRules(@Valid @RequestBody ConvertRulesRequest request) {
        RuleConversionResult result = naturalLanguageRuleService.convert(request.getQuery());
        RuleConversionResponse body = RuleConversionResponse.builder()
                .status(result.status().name())
                .confidence(result.confidence())
                .ruleGroup(result.definition())
                .description(result.description())
                .reason(result.reason())
                .fallbackVersion(result.fallbackVersion())
                .build();

        if (result.status() == RuleConversionResult.Status.FAILURE) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/message-suggestions")
    @Operation(summary = "Suggest campaign messages",
            description = "Generated copywriting suggestions, or built-in messages when generation is unavailable")
    public ResponseEntity<MessageSuggestionResponse> suggestMessages(
            @Valid @RequestBody MessageSuggestionRequest request) {
        return ResponseEntity.ok(messageSuggestionService.generateSuggestions(
                request.getCampaignType(), request.getAudienceDescription(), request.getContext()));
    }
}
