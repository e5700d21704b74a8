package com.eyelevel.ocrprocessor.repository;

import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for job metadata and results. Every entry is written with an expiry equal to the
 * retention window measured from the write, so repeated writes refresh it. A separate time-ordered
 * index of job ids drives {@link #sweepExpired(Instant)}.
 * <p>
 * Each method is a single atomic store operation. Read-modify-write sequences are not protected;
 * callers rely on a job having a single writer after creation and use {@link #replace(Job)} so that a
 * concurrent delete is never undone.
 * <p>
 * Implementations signal connectivity or write failures with
 * {@link com.eyelevel.ocrprocessor.exception.JobStoreException}.
 */
public interface JobStore {

    /**
     * Writes (or overwrites) the job record and refreshes its expiry.
     */
    void put(Job job);

    /**
     * Overwrites the job record only if it still exists, refreshing its expiry.
     *
     * @return {@code false} if the record was absent or expired, in which case nothing is written.
     */
    boolean replace(Job job);

    Optional<Job> get(String jobId);

    /**
     * Writes the result of a job.
     *
     * @throws com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException if the owning job record is
     *                                                                            absent or already expired.
     */
    void putResult(String jobId, JobResult result);

    Optional<JobResult> getResult(String jobId);

    /**
     * Removes the result of a job, leaving the job record in place.
     */
    void deleteResult(String jobId);

    /**
     * Records the job in the time-ordered retention index.
     */
    void indexAdd(String jobId, Instant timestamp);

    /**
     * Removes every job (and its result) whose index timestamp is older than {@code now - retention},
     * then trims those entries from the index. Records that already expired on their own are not an error.
     *
     * @return the ids of the swept jobs.
     */
    List<String> sweepExpired(Instant now);

    /**
     * Removes a job, its result and its index entry.
     *
     * @return {@code true} if a job or result record existed.
     */
    boolean delete(String jobId);
}
