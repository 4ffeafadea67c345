package com.minicrm.backend.controller;

import com.minicrm.backend.dto.CreateSegmentRequest;
import com.minicrm.backend.dto.CustomerSummary;
import com.minicrm.backend.dto.FieldOptionsResponse;
import com.minicrm.backend.dto.PreviewRequest;
import com.minicrm.backend.dto.SegmentResponse;
import com.minicrm.backend.dto.UpdateSegmentRequest;
import com.minicrm.backend.model.Segment;
import com.minicrm.backend.rules.DataType;
import com.minicrm.backend.rules.EvaluationException;
import com.minicrm.backend.rules.FieldCatalog;
import com.minicrm.backend.rules.FieldDefinition;
import com.minicrm.backend.rules.Operator;
import com.minicrm.backend.rules.RuleValidationException;
import com.minicrm.backend.service.SegmentNotFoundException;
import com.minicrm.backend.service.SegmentService;
import com.minicrm.backend.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.web.bind.annotation.*;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/segments")
@Tag(name = "Segments", description = "Customer segmentation")
public class SegmentController {

    private final SegmentService segmentService;
    private final FieldCatalog fieldCatalog;

    public SegmentController(SegmentService segmentService, FieldCatalog fieldCatalog) {
        this.segmentService = segmentService;
        this.fieldCatalog = fieldCatalog;
    }

    @GetMapping("/fields")
    @Operation(summary = "Get field options", description = "Fields, operators and allowed values for segment rules")
    public ResponseEntity<FieldOptionsResponse> getFieldOptions() {
        List<FieldOptionsResponse.FieldOption> fields = fieldCatalog.fields().stream()
                .map(this::toFieldOption)
                .collect(Collectors.toList());

        Map<String, List<FieldOptionsResponse.OperatorOption>> operators = new LinkedHashMap<>();
        for (DataType type : DataType.values()) {
            operators.put(type.getCode(), toOperatorOptions(type.getOperators()));
        }

        return ResponseEntity.ok(FieldOptionsResponse.builder()
                .fields(fields)
                .operators(operators)
                .build());
    }

    @PostMapping
    @Operation(summary = "Create segment", description = "Validate rules, count the audience and save the segment")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Segment created"),
            @ApiResponse(responseCode = "400", description = "Invalid request or rules"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "503", description = "Audience could not be evaluated")
    })
    public ResponseEntity<?> createSegment(
            @AuthenticationPrincipal OAuth2User principal,
            @Valid @RequestBody CreateSegmentRequest request) {

        try {
            Segment segment = segmentService.createSegment(UserService.oauthId(principal), request);
            return ResponseEntity.status(HttpStatus.CREATED).body(toSegmentResponse(segment));
        } catch (RuleValidationException e) {
            return ErrorResponses.invalidRules(e);
        } catch (EvaluationException e) {
            return ErrorResponses.evaluationFailed(e);
        }
    }

    @GetMapping
    @Operation(summary = "List segments", description = "Paginated segments of the authenticated user, newest first")
    public ResponseEntity<Page<SegmentResponse>> listSegments(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Case-insensitive text in name or description") @RequestParam(required = false) String search,
            @Parameter(description = "Filter on active flag") @RequestParam(required = false) Boolean active,
            @Parameter(description = "Match segments with any of these tags") @RequestParam(required = false) List<String> tags,
            Pageable pageable) {

        Page<SegmentResponse> segments = segmentService
                .listSegments(UserService.oauthId(principal), search, active, tags, pageable)
                .map(this::toSegmentResponse);
        return ResponseEntity.ok(segments);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get segment")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segment found"),
            @ApiResponse(responseCode = "404", description = "Segment not found")
    })
    public ResponseEntity<SegmentResponse> getSegment(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Segment ID") @PathVariable String id) {

        return segmentService.findForOwner(id, UserService.oauthId(principal))
                .map(segment -> ResponseEntity.ok(toSegmentResponse(segment)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update segment", description = "Update a segment; new rules are validated and recounted")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segment updated"),
            @ApiResponse(responseCode = "400", description = "Invalid request or rules"),
            @ApiResponse(responseCode = "404", description = "Segment not found"),
            @ApiResponse(responseCode = "503", description = "Audience could not be evaluated")
    })
    public ResponseEntity<?> updateSegment(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Segment ID") @PathVariable String id,
            @Valid @RequestBody UpdateSegmentRequest request) {

        try {
            Segment segment = segmentService.updateSegment(id, UserService.oauthId(principal), request);
            return ResponseEntity.ok(toSegmentResponse(segment));
        } catch (RuleValidationException e) {
            return ErrorResponses.invalidRules(e);
        } catch (EvaluationException e) {
            return ErrorResponses.evaluationFailed(e);
        } catch (SegmentNotFoundException e) {
            return ErrorResponses.notFound(e);
        }
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete segment", description = "Soft delete: the segment is marked inactive")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segment deactivated"),
            @ApiResponse(responseCode = "404", description = "Segment not found")
    })
    public ResponseEntity<?> deleteSegment(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Segment ID") @PathVariable String id) {

        try {
            Segment segment = segmentService.deleteSegment(id, UserService.oauthId(principal));
            return ResponseEntity.ok(toSegmentResponse(segment));
        } catch (SegmentNotFoundException e) {
            return ErrorResponses.notFound(e);
        }
    }

    @PostMapping("/preview")
    @Operation(summary = "Preview audience", description = "Count and sample the audience of unsaved rules")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Audience preview"),
            @ApiResponse(responseCode = "400", description = "Invalid rules"),
            @ApiResponse(responseCode = "503", description = "Audience could not be evaluated")
    })
    public ResponseEntity<?> previewSegment(@Valid @RequestBody PreviewRequest request) {
        try {
            return ResponseEntity.ok(segmentService.preview(request.getRuleGroups()));
        } catch (RuleValidationException e) {
            return ErrorResponses.invalidRules(e);
        } catch (EvaluationException e) {
            return ErrorResponses.evaluationFailed(e);
        }
    }

    @GetMapping("/{id}/customers")
    @Operation(summary = "List segment customers", description = "Paginated audience of a segment ordered by customerId")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Audience page"),
            @ApiResponse(responseCode = "404", description = "Segment not found"),
            @ApiResponse(responseCode = "503", description = "Audience could not be evaluated")
    })
    public ResponseEntity<?> getSegmentCustomers(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Segment ID") @PathVariable String id,
            Pageable pageable) {

        try {
            Page<CustomerSummary> customers = segmentService.findCustomers(id, UserService.oauthId(principal),
                    pageable);
            return ResponseEntity.ok(customers);
        } catch (SegmentNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (RuleValidationException e) {
            return ErrorResponses.invalidRules(e);
        } catch (EvaluationException e) {
            return ErrorResponses.evaluationFailed(e);
        }
    }

    @PostMapping("/{id}/recalculate")
    @Operation(summary = "Recalculate audience", description = "Recount the audience of a segment")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Audience size updated"),
            @ApiResponse(responseCode = "404", description = "Segment not found"),
            @ApiResponse(responseCode = "503", description = "Audience could not be evaluated")
    })
    public ResponseEntity<?> recalculateSegment(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Segment ID") @PathVariable String id) {

        try {
            Segment segment = segmentService.recalculate(id, UserService.oauthId(principal));
            return ResponseEntity.ok(toSegmentResponse(segment));
        } catch (SegmentNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (RuleValidationException e) {
            return ErrorResponses.invalidRules(e);
        } catch (EvaluationException e) {
            return ErrorResponses.evaluationFailed(e);
        }
    }

    private FieldOptionsResponse.FieldOption toFieldOption(FieldDefinition field) {
        return FieldOptionsResponse.FieldOption.builder()
                .name(field.getName())
                .label(field.getLabel())
                .type(field.getDataType().getCode())
                .operators(toOperatorOptions(field.getOperators()))
                .options(field.getOptions())
                .derived(field.isDerived())
                .build();
    }

    private List<FieldOptionsResponse.OperatorOption> toOperatorOptions(Collection<Operator> operators) {
        return operators.stream()
                .map(operator -> FieldOptionsResponse.OperatorOption.builder()
                        .value(operator.getCode())
                        .label(operator.getLabel())
                        .build())
                .collect(Collectors.toList());
    }

    private SegmentResponse toSegmentResponse(Segment segment) {
        return SegmentResponse.builder()
                .id(segment.getId())
                .name(segment.getName())
                .description(segment.getDescription())
                .createdBy(segment.getCreatedBy())
                .ruleGroups(segment.getRuleGroups())
                .naturalLanguageQuery(segment.getNaturalLanguageQuery())
                .ruleConfidence(segment.getRuleConfidence())
                .audienceSize(segment.getAudienceSize())
                .lastCalculated(segment.getLastCalculated())
                .active(segment.isActive())
                .tags(segment.getTags())
                .createdAt(segment.getCreatedAt())
                .updatedAt(segment.getUpdatedAt())
                .build();
    }
}
