package com.eyelevel.ocrprocessor.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a result is requested for a job that failed. Carries the stored failure message.
 */
@Getter
public class JobFailedException extends OcrProcessingException {
    @Serial
    private static final long serialVersionUID = -6180321937525400138L;

    private final String jobId;
    private final String failureMessage;

    public JobFailedException(String jobId, String failureMessage) {
        super(String.format("Job %s failed: %s", jobId, failureMessage));
        this.jobId = jobId;
        this.failureMessage = failureMessage;
    }
}
