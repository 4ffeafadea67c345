package com.minicrm.backend.controller;

import com.minicrm.backend.dto.ErrorResponse;
import com.minicrm.backend.rules.EvaluationException;
import com.minicrm.backend.rules.RuleValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Response bodies shared by the segment endpoints.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static ResponseEntity<ErrorResponse> invalidRules(RuleValidationException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error(e.getErrorCode())
                .message(e.getMessage())
                .path(e.getPath())
                .ruleId(e.getRuleId())
                .build());
    }

    /**
     * Audience queries fail transiently; clients may retry once.
     */
    static ResponseEntity<ErrorResponse> evaluationFailed(EvaluationException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.builder()
                .error("EVALUATION_FAILED")
                .message("Audience could not be evaluated, please retry")
                .build());
    }

    static ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                .error("NOT_FOUND")
                .message(e.getMessage())
                .build());
    }
}
