package com.eyelevel.ocrprocessor.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a job id is unknown to the store, either because it never existed or because it expired.
 */
@Getter
public class JobNotFoundException extends NotFoundException {

    @Serial
    private static final long serialVersionUID = 2780193360248475116L;

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super(String.format("Job %s not found", jobId));
        this.jobId = jobId;
    }
}
