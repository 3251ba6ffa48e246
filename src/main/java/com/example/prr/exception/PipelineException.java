package com.example.prr.exception;

import com.example.prr.model.ErrorCategory;

/**
 * Base exception for pipeline errors that must reach the caller.
 */
public class PipelineException extends RuntimeException {

    private final ErrorCategory category;

    public PipelineException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public PipelineException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
