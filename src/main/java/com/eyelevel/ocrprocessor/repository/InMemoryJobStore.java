package com.eyelevel.ocrprocessor.repository;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link JobStore} with the same expiry semantics as the Redis store. Intended for local
 * development ({@code app.processing.store.type=memory}) and tests; state does not survive a restart.
 * <p>
 * Job records are copied on every read and write, matching the snapshot semantics of a networked store.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "app.processing.store", name = "type", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Map<String, Expiring<Job>> jobs = new ConcurrentHashMap<>();
    private final Map<String, Expiring<JobResult>> results = new ConcurrentHashMap<>();
    private final Map<String, Instant> index = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public InMemoryJobStore(OcrProcessingConfig config, Clock clock) {
        this.retention = config.getRetention();
        this.clock = clock;
        log.warn("Using the in-memory job store. Jobs will not survive a restart.");
    }

    @Override
    public void put(Job job) {
        jobs.put(job.getId(), new Expiring<>(job.toBuilder().build(), expiry()));
    }

    @Override
    public boolean replace(Job job) {
        final Expiring<Job> replacement = new Expiring<>(job.toBuilder().build(), expiry());
        final Instant now = clock.instant();
        final Expiring<Job> written = jobs.computeIfPresent(job.getId(),
                (id, current) -> current.expiresAt().isAfter(now) ? replacement : null);
        return written != null;
    }

    @Override
    public Optional<Job> get(String jobId) {
        return live(jobs, jobId).map(job -> job.toBuilder().build());
    }

    @Override
    public void putResult(String jobId, JobResult result) {
        if (live(jobs, jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        results.put(jobId, new Expiring<>(result, expiry()));
    }

    @Override
    public Optional<JobResult> getResult(String jobId) {
        return live(results, jobId);
    }

    @Override
    public void deleteResult(String jobId) {
        results.remove(jobId);
    }

    @Override
    public void indexAdd(String jobId, Instant timestamp) {
        index.put(jobId, timestamp);
    }

    @Override
    public List<String> sweepExpired(Instant now) {
        final Instant cutoff = now.minus(retention);
        final List<String> expiredIds = index.entrySet().stream()
                .filter(entry -> !entry.getValue().isAfter(cutoff))
                .map(Map.Entry::getKey)
                .toList();

        for (final String jobId : expiredIds) {
            jobs.remove(jobId);
            results.remove(jobId);
            index.remove(jobId);
        }
        return expiredIds;
    }

    @Override
    public boolean delete(String jobId) {
        final boolean existed = live(jobs, jobId).isPresent() || live(results, jobId).isPresent();
        jobs.remove(jobId);
        results.remove(jobId);
        index.remove(jobId);
        return existed;
    }

    private Instant expiry() {
        return clock.instant().plus(retention);
    }

    private <T> Optional<T> live(Map<String, Expiring<T>> entries, String key) {
        final Expiring<T> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    private record Expiring<T>(T value, Instant expiresAt) {
    }
}
