package com.minicrm.backend.controller;

import com.minicrm.backend.dto.RecalculationSummary;
import com.minicrm.backend.service.SegmentService;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Maintenance endpoints for schedulers, guarded by the internal API key.
 */
@RestController
@RequestMapping("/internal/segments")
@Tag(name = "Internal", description = "Internal segment maintenance")
@Hidden
public class InternalSegmentController {

    private static final Logger log = LoggerFactory.getLogger(InternalSegmentController.class);

    private final SegmentService segmentService;

    public InternalSegmentController(SegmentService segmentService) {
        this.segmentService = segmentService;
    }

    @PostMapping("/recalculate")
    @Operation(summary = "Recalculate all segments", description = "Recount the audience of every active segment")
    public ResponseEntity<RecalculationSummary> recalculateAll() {
        log.info("[INTERNAL] Recalculating all active segments");
        RecalculationSummary summary = segmentService.recalculateAll();
        return ResponseEntity.ok(summary);
    }
}
