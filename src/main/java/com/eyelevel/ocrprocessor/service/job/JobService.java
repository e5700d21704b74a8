package com.eyelevel.ocrprocessor.service.job;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.dto.job.ProcessingOptions;
import com.eyelevel.ocrprocessor.exception.JobFailedException;
import com.eyelevel.ocrprocessor.exception.JobSchedulingException;
import com.eyelevel.ocrprocessor.exception.JobStillProcessingException;
import com.eyelevel.ocrprocessor.exception.UnsupportedFileTypeException;
import com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import com.eyelevel.ocrprocessor.model.JobStatus;
import com.eyelevel.ocrprocessor.model.OutputFormat;
import com.eyelevel.ocrprocessor.repository.JobStore;
import com.eyelevel.ocrprocessor.service.file.FileTypeResolver;
import com.eyelevel.ocrprocessor.service.file.UploadStorageService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The entry point for the API layer. Creates jobs, hands them to the background executor and answers
 * status, result, cleanup and delete queries from the {@link JobStore}.
 */
@Slf4j
@Service
public class JobService {

    private final JobStore jobStore;
    private final JobDispatcher jobDispatcher;
    private final JobLifecycleManager lifecycleManager;
    private final FileTypeResolver fileTypeResolver;
    private final UploadStorageService uploadStorageService;
    private final OcrProcessingConfig config;
    private final AsyncTaskExecutor taskExecutor;
    private final Clock clock;

    public JobService(JobStore jobStore, JobDispatcher jobDispatcher, JobLifecycleManager lifecycleManager,
                      FileTypeResolver fileTypeResolver, UploadStorageService uploadStorageService,
                      OcrProcessingConfig config, @Qualifier("jobDispatchExecutor") AsyncTaskExecutor taskExecutor,
                      Clock clock) {
        this.jobStore = jobStore;
        this.jobDispatcher = jobDispatcher;
        this.lifecycleManager = lifecycleManager;
        this.fileTypeResolver = fileTypeResolver;
        this.uploadStorageService = uploadStorageService;
        this.config = config;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    /**
     * Creates a new {@code pending} job with a fresh id and indexes it for retention.
     *
     * @param fileName The original file name.
     * @param category The category, or {@code null} to resolve it from the extension at dispatch time.
     * @return The persisted job.
     */
    public Job create(final String fileName, final FileCategory category) {
        final Instant now = clock.instant();
        final Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .fileName(fileName)
                .category(category)
                .status(JobStatus.PENDING)
                .progress(0)
                .message("Job created")
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobStore.put(job);
        jobStore.indexAdd(job.getId(), now);
        log.info("[JobId: {}] Created job for file '{}' ({}).", job.getId(), fileName,
                 category == null ? "auto" : category.getValue());
        return job;
    }

    /**
     * Hands the job to the background executor. Returns immediately.
     *
     * @throws JobSchedulingException if the executor rejects the task. The job is marked {@code failed} first.
     */
    public void schedule(final Job job, final Path filePath, final ProcessingOptions options, final boolean discardSource) {
        final OutputFormat outputFormat = options == null ? OutputFormat.JSON : options.getOutputFormat();
        final DispatchRequest request = DispatchRequest.builder()
                .jobId(job.getId())
                .fileName(job.getFileName())
                .filePath(filePath)
                .category(job.getCategory())
                .outputFormat(outputFormat)
                .outputDir(outputFormat == OutputFormat.FILES ? config.getOutputDir().resolve(job.getId()) : null)
                .discardSource(discardSource)
                .build();
        try {
            taskExecutor.execute(() -> jobDispatcher.dispatch(request));
            log.info("[JobId: {}] Scheduled for background processing (output: {}).", job.getId(), outputFormat.getValue());
        } catch (final TaskRejectedException e) {
            log.error("[JobId: {}] Background executor rejected the job.", job.getId(), e);
            lifecycleManager.fail(job.getId(), "Processing failed: could not schedule job");
            throw new JobSchedulingException("Could not schedule job " + job.getId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stores an upload, creates its job and schedules it.
     *
     * @param fileName          The client-supplied file name.
     * @param content           The upload content.
     * @param requestedCategory The category of a category-specific endpoint, or {@code null} to detect it.
     * @param options           Processing options; defaults apply when {@code null}.
     * @return The {@code pending} job.
     * @throws UnsupportedFileTypeException if the extension is unsupported or does not match the requested category.
     */
    public Job submit(final String fileName, final InputStream content, final FileCategory requestedCategory,
                      final ProcessingOptions options) {
        final FileCategory detected = fileTypeResolver.resolve(fileName).orElse(null);
        if (requestedCategory != null && detected != requestedCategory) {
            throw new UnsupportedFileTypeException(String.format("Invalid file type for %s processing. Supported: %s",
                    requestedCategory.getValue(), fileTypeResolver.describe(requestedCategory)));
        }
        final FileCategory category = detected != null ? detected : fileTypeResolver.require(fileName);

        final Path stored = uploadStorageService.store(fileName, content);
        try {
            final Job job = create(fileName, category);
            schedule(job, stored, options, true);
            return job;
        } catch (final RuntimeException e) {
            uploadStorageService.discard(stored);
            throw e;
        }
    }

    /**
     * @throws JobNotFoundException if the job is unknown or expired.
     */
    public Job status(final String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * @return The result of a completed job.
     * @throws JobNotFoundException        if the job is unknown or expired.
     * @throws JobFailedException          if the job failed; carries the failure message.
     * @throws JobStillProcessingException if the job has not finished yet.
     */
    public JobResult result(final String jobId) {
        final Job job = status(jobId);
        switch (job.getStatus()) {
            case FAILED:
                throw new JobFailedException(jobId, job.getMessage());
            case COMPLETED:
                return jobStore.getResult(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            default:
                throw new JobStillProcessingException(jobId, job.getStatus(), job.getProgress());
        }
    }

    /**
     * Runs the retention sweep now. The {@code files} output directories of swept jobs are removed as well.
     *
     * @return the number of jobs removed.
     */
    public int cleanup() {
        final List<String> sweptIds = jobStore.sweepExpired(clock.instant());
        sweptIds.forEach(this::deleteOutputDir);
        log.info("Retention sweep removed {} expired job(s).", sweptIds.size());
        return sweptIds.size();
    }

    /**
     * Removes a job, its result and its {@code files} output directory. A running dispatch is not interrupted.
     *
     * @throws JobNotFoundException if the job is unknown or expired.
     */
    public void delete(final String jobId) {
        if (!jobStore.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        deleteOutputDir(jobId);
        log.info("[JobId: {}] Job deleted.", jobId);
    }

    private void deleteOutputDir(final String jobId) {
        final Path outputDir = config.getOutputDir().resolve(jobId);
        if (Files.isDirectory(outputDir)) {
            try {
                FileUtils.deleteDirectory(outputDir.toFile());
            } catch (final IOException e) {
                log.error("[JobId: {}] Failed to delete output directory: {}", jobId, outputDir, e);
            }
        }
    }
}
