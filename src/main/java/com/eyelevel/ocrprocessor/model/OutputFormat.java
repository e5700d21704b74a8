package com.eyelevel.ocrprocessor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a job's extraction output is delivered.
 */
public enum OutputFormat {
    /**
     * Everything is returned inline in the result; the working directory is scratch space removed after the job.
     */
    JSON("json"),
    /**
     * Text, table and image artifacts are kept on disk and the result carries their paths.
     */
    FILES("files");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OutputFormat fromValue(String value) {
        for (OutputFormat format : values()) {
            if (format.value.equalsIgnoreCase(value) || format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + value);
    }
}
