package com.example.regreport.exception;

public class ArtifactWriteException extends ReportPipelineException {

    public ArtifactWriteException(String message) {
        super(message);
    }

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
