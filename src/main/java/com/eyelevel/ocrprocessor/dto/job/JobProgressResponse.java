package com.eyelevel.ocrprocessor.dto.job;

import com.eyelevel.ocrprocessor.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Returned with HTTP 202 when the result of a job that is still running is requested.
 */
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class JobProgressResponse {

    private String jobId;

    private JobStatus status;

    private int progress;
}
