package com.eyelevel.ocrprocessor.service.handlers;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Everything a {@link CategoryHandler} needs for one job.
 */
@Value
@Builder
public class HandlerContext {

    String jobId;

    /**
     * The caller's file name, used to derive artifact names.
     */
    String fileName;

    Path filePath;

    /**
     * Existing directory that receives the text, table and image artifacts.
     */
    Path workingDir;

    ProgressReporter progressReporter;

    public void report(int progress, String message) {
        progressReporter.report(progress, message);
    }
}
