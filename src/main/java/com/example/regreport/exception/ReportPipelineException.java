package com.example.regreport.exception;

/**
 * Base of the fatal conditions that abort a report run.
 */
public class ReportPipelineException extends RuntimeException {

    public ReportPipelineException(String message) {
        super(message);
    }

    public ReportPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
