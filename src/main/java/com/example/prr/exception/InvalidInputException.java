package com.example.prr.exception;

import com.example.prr.model.ErrorCategory;

/**
 * Malformed or missing upstream input. Never retried; surfaced to the caller immediately.
 */
public class InvalidInputException extends PipelineException {

    public InvalidInputException(String message) {
        super(ErrorCategory.INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(ErrorCategory.INPUT, message, cause);
    }
}
