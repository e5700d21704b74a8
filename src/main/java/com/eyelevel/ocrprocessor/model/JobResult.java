package com.eyelevel.ocrprocessor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The extraction output of a completed job. Stored exactly once, alongside the job, when the job
 * reaches {@link JobStatus#COMPLETED}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {

    private String jobId;

    private String fileName;

    private FileCategory category;

    @Builder.Default
    private List<TextFragment> texts = new ArrayList<>();

    @Builder.Default
    private List<TableFragment> tables = new ArrayList<>();

    @Builder.Default
    private List<ImageReference> images = new ArrayList<>();

    /**
     * Named artifacts on disk ({@code text}, {@code tables}, {@code images_dir}). Empty for inline results.
     */
    @Builder.Default
    private Map<String, String> outputFiles = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
