package com.eyelevel.ocrprocessor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Defines the lifecycle states of a {@link Job}. Statuses only move forward:
 * {@code PENDING -> PROCESSING -> COMPLETED | FAILED}, and a pending job may fail before it starts.
 */
public enum JobStatus {
    /**
     * The job has been created and is waiting for a dispatcher to pick it up.
     */
    PENDING("pending"),
    /**
     * A dispatcher is actively extracting content for the job.
     */
    PROCESSING("processing"),
    /**
     * Extraction finished and the result has been stored.
     */
    COMPLETED("completed"),
    /**
     * An unrecoverable error occurred. The job carries the failure message and has no result.
     */
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job in this status may be written with {@code next}. Re-writing
     * {@code PROCESSING} is allowed so progress updates can be recorded.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == PROCESSING || next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + value));
    }
}
