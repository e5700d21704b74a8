package com.eyelevel.ocrprocessor.exception;

import com.eyelevel.ocrprocessor.model.JobStatus;
import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a result is requested for a job that has not reached a terminal status yet.
 */
@Getter
public class JobStillProcessingException extends OcrProcessingException {
    @Serial
    private static final long serialVersionUID = 1893004753358157216L;

    private final String jobId;
    private final JobStatus status;
    private final int progress;

    public JobStillProcessingException(String jobId, JobStatus status, int progress) {
        super(String.format("Job %s is still %s. Current progress: %d%%", jobId, status.getValue(), progress));
        this.jobId = jobId;
        this.status = status;
        this.progress = progress;
    }
}
