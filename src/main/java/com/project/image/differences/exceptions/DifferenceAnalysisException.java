package com.project.image.differences.exceptions;

/** Domain-specific exception for detection failures. */
public class DifferenceAnalysisException extends RuntimeException {
    private final AnalysisError error;

    public DifferenceAnalysisException(AnalysisError error, String message) {
        super(message);
        this.error = error;
    }

    public DifferenceAnalysisException(AnalysisError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public AnalysisError getError() { return error; }
}
