package com.company.dashboards.exception;

/**
 * Plan construction failed on an already validated definition. Always a defect, never retried.
 */
public class CompilationException extends RuntimeException {
    public CompilationException(String slug, Throwable cause) {
        super("Failed to compile dashboard " + slug + ": " + cause.getMessage(), cause);
    }
}
