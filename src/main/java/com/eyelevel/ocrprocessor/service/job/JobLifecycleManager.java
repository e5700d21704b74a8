package com.eyelevel.ocrprocessor.service.job;

import com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import com.eyelevel.ocrprocessor.model.JobStatus;
import com.eyelevel.ocrprocessor.repository.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * The single place that mutates a stored {@link Job} after creation.
 * <p>
 * Every write goes through {@link JobStatus#canTransitionTo(JobStatus)} and keeps progress non-decreasing.
 * A write that would move a job backwards (or touch a terminal job) is logged and skipped, and the stored
 * job is returned unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleManager {

    public static final String COMPLETED_MESSAGE = "Processing completed successfully";

    private final JobStore jobStore;
    private final Clock clock;

    /**
     * Moves a pending job to {@link JobStatus#PROCESSING}.
     *
     * @throws JobNotFoundException if the job no longer exists.
     */
    public Job markProcessing(final String jobId, final int progress, final String message) {
        return transition(jobId, JobStatus.PROCESSING, progress, message);
    }

    /**
     * Records an intermediate checkpoint of a processing job.
     *
     * @throws JobNotFoundException if the job no longer exists.
     */
    public Job updateProgress(final String jobId, final int progress, final String message) {
        return transition(jobId, JobStatus.PROCESSING, progress, message);
    }

    /**
     * Stores the result and then marks the job {@link JobStatus#COMPLETED} at 100%. The result is written first
     * so that a completed job always has one. If the job write fails the result is removed again, so a job that
     * ends up {@code failed} has none.
     *
     * @throws JobNotFoundException if the job no longer exists.
     */
    public Job complete(final String jobId, final JobResult result) {
        final Job job = load(jobId);
        if (!job.getStatus().canTransitionTo(JobStatus.COMPLETED)) {
            log.warn("[JobId: {}] Ignoring completion of a job in status '{}'.", jobId, job.getStatus().getValue());
            return job;
        }
        jobStore.putResult(jobId, result);
        final Job completed;
        try {
            completed = write(job, JobStatus.COMPLETED, 100, COMPLETED_MESSAGE);
        } catch (final RuntimeException e) {
            discardResult(jobId, e);
            throw e;
        }
        log.info("[JobId: {}] Job COMPLETED.", jobId);
        return completed;
    }

    /**
     * Marks the job {@link JobStatus#FAILED}, keeping its current progress.
     *
     * @throws JobNotFoundException if the job no longer exists.
     */
    public Job fail(final String jobId, final String message) {
        final Job job = load(jobId);
        if (!job.getStatus().canTransitionTo(JobStatus.FAILED)) {
            log.warn("[JobId: {}] Ignoring failure of a job in status '{}'. Reason: {}", jobId,
                     job.getStatus().getValue(), message);
            return job;
        }
        final Job failed = write(job, JobStatus.FAILED, job.getProgress(), message);
        log.warn("[JobId: {}] Job marked as FAILED. Reason: {}", jobId, message);
        return failed;
    }

    private Job transition(final String jobId, final JobStatus next, final int progress, final String message) {
        final Job job = load(jobId);
        if (!job.getStatus().canTransitionTo(next)) {
            log.warn("[JobId: {}] Ignoring transition from '{}' to '{}'.", jobId, job.getStatus().getValue(),
                     next.getValue());
            return job;
        }
        final Job updated = write(job, next, progress, message);
        log.info("[JobId: {}] {} ({}%): {}", jobId, next.getValue(), updated.getProgress(), message);
        return updated;
    }

    private Job write(final Job current, final JobStatus status, final int progress, final String message) {
        final Job updated = current.toBuilder()
                .status(status)
                .progress(Math.max(current.getProgress(), Math.min(progress, 100)))
                .message(message)
                .updatedAt(clock.instant())
                .build();
        if (!jobStore.replace(updated)) {
            // Deleted (or expired) since it was loaded.
            throw new JobNotFoundException(current.getId());
        }
        return updated;
    }

    private void discardResult(final String jobId, final RuntimeException cause) {
        try {
            jobStore.deleteResult(jobId);
        } catch (final RuntimeException e) {
            log.error("[JobId: {}] Failed to remove the result of a job that could not be completed.", jobId, e);
            cause.addSuppressed(e);
        }
    }

    private Job load(final String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
