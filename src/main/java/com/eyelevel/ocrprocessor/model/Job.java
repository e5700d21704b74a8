package com.eyelevel.ocrprocessor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single unit of extraction work. A job is created {@link JobStatus#PENDING}, mutated only by the
 * dispatcher while it runs, and expires from the store after the retention window.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String id;

    private String fileName;

    private FileCategory category;

    private JobStatus status;

    /**
     * Informational progress percentage, 0 to 100. Never decreases.
     */
    private int progress;

    /**
     * The latest human-readable status note. Always present on a failed job.
     */
    private String message;

    private Instant createdAt;

    private Instant updatedAt;
}
