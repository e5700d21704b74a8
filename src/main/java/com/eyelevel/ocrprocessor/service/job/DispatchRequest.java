package com.eyelevel.ocrprocessor.service.job;

import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.OutputFormat;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * The input of one {@link JobDispatcher#dispatch(DispatchRequest)} run.
 */
@Value
@Builder
public class DispatchRequest {

    String jobId;

    String fileName;

    Path filePath;

    /**
     * The category to process the file as. Resolved from {@link #fileName} when {@code null}.
     */
    FileCategory category;

    @Builder.Default
    OutputFormat outputFormat = OutputFormat.JSON;

    /**
     * Where {@link OutputFormat#FILES} artifacts go. Defaults to {@code <output-dir>/<jobId>}.
     */
    Path outputDir;

    /**
     * Whether {@link #filePath} is a stored upload owned by the job and should be deleted once it finishes.
     */
    boolean discardSource;
}
