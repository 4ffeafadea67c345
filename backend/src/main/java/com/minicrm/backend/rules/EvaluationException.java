package com.minicrm.backend.rules;

import lombok.Getter;

/**
 * The data store rejected or failed to run a compiled audience query.
 */
@Getter
public class EvaluationException extends RuntimeException {

    private final String pipeline;

    public EvaluationException(String message, String pipeline, Throwable cause) {
        super(message, cause);
        this.pipeline = pipeline;
    }
}
