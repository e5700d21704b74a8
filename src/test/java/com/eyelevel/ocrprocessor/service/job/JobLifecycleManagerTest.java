package com.eyelevel.ocrprocessor.service.job;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.JobStoreException;
import com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import com.eyelevel.ocrprocessor.model.JobStatus;
import com.eyelevel.ocrprocessor.repository.InMemoryJobStore;
import com.eyelevel.ocrprocessor.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobLifecycleManagerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryJobStore store;
    private JobLifecycleManager lifecycle;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryJobStore(new OcrProcessingConfig(), clock);
        lifecycle = new JobLifecycleManager(store, clock);
        store.put(Job.builder()
                .id("j1")
                .fileName("scan.png")
                .category(FileCategory.IMAGE)
                .status(JobStatus.PENDING)
                .message("Job created")
                .createdAt(START)
                .updatedAt(START)
                .build());
    }

    @Test
    void markProcessing_movesPendingJobAndStampsUpdateTime() {
        // Given
        clock.advance(Duration.ofSeconds(5));

        // When
        Job job = lifecycle.markProcessing("j1", 10, "Starting image processing");

        // Then
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getProgress()).isEqualTo(10);
        assertThat(job.getUpdatedAt()).isEqualTo(START.plusSeconds(5));
        assertThat(job.getCreatedAt()).isEqualTo(START);
        assertThat(store.get("j1")).get().isEqualTo(job);
    }

    @Test
    void updateProgress_neverDecreasesProgress() {
        // Given
        lifecycle.markProcessing("j1", 10, "start");
        lifecycle.updateProgress("j1", 70, "halfway");

        // When
        Job job = lifecycle.updateProgress("j1", 30, "late checkpoint");

        // Then
        assertThat(job.getProgress()).isEqualTo(70);
        assertThat(job.getMessage()).isEqualTo("late checkpoint");
    }

    @Test
    void updateProgress_capsAtOneHundred() {
        lifecycle.markProcessing("j1", 10, "start");

        assertThat(lifecycle.updateProgress("j1", 250, "overshoot").getProgress()).isEqualTo(100);
    }

    @Test
    void complete_storesResultBeforeMarkingCompleted() {
        // Given
        lifecycle.markProcessing("j1", 10, "start");

        // When
        Job job = lifecycle.complete("j1", JobResult.builder().jobId("j1").build());

        // Then
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getMessage()).isEqualTo(JobLifecycleManager.COMPLETED_MESSAGE);
        assertThat(store.getResult("j1")).isPresent();
    }

    @Test
    void complete_isIgnoredForPendingJob() {
        // When
        Job job = lifecycle.complete("j1", JobResult.builder().jobId("j1").build());

        // Then
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(store.getResult("j1")).isEmpty();
    }

    @Test
    void fail_keepsProgressAndRecordsMessage() {
        // Given
        lifecycle.markProcessing("j1", 10, "start");
        lifecycle.updateProgress("j1", 30, "extracting");

        // When
        Job job = lifecycle.fail("j1", "Processing failed: boom");

        // Then
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getProgress()).isEqualTo(30);
        assertThat(job.getMessage()).isEqualTo("Processing failed: boom");
    }

    @Test
    void pendingJobCanFailBeforeItStarts() {
        assertThat(lifecycle.fail("j1", "rejected").getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void terminalJobsAreNeverOverwritten() {
        // Given
        lifecycle.markProcessing("j1", 10, "start");
        lifecycle.fail("j1", "Processing failed: boom");

        // When
        lifecycle.updateProgress("j1", 90, "stray checkpoint");
        lifecycle.complete("j1", JobResult.builder().jobId("j1").build());

        // Then
        Job stored = store.get("j1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.getMessage()).isEqualTo("Processing failed: boom");
        assertThat(stored.getProgress()).isEqualTo(10);
        assertThat(store.getResult("j1")).isEmpty();
    }

    @Test
    void concurrentReadersNeverObserveProgressDecrease() throws Exception {
        // Given
        lifecycle.markProcessing("j1", 10, "start");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean regression = new AtomicBoolean(false);
        CountDownLatch writerDone = new CountDownLatch(1);

        // When
        for (int reader = 0; reader < 3; reader++) {
            pool.submit(() -> {
                int last = 0;
                while (writerDone.getCount() > 0) {
                    int seen = store.get("j1").orElseThrow().getProgress();
                    if (seen < last) {
                        regression.set(true);
                    }
                    last = seen;
                }
            });
        }
        pool.submit(() -> {
            try {
                for (int progress = 10; progress <= 90; progress++) {
                    lifecycle.updateProgress("j1", progress % 2 == 0 ? progress : progress - 5, "step");
                }
                lifecycle.complete("j1", JobResult.builder().jobId("j1").build());
            } finally {
                writerDone.countDown();
            }
        });

        // Then
        assertThat(writerDone.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(regression).isFalse();
        assertThat(store.get("j1")).get().extracting(Job::getProgress).isEqualTo(100);
    }

    @Test
    void missingJobIsReported() {
        assertThatThrownBy(() -> lifecycle.updateProgress("ghost", 20, "nope"))
                .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> lifecycle.fail("ghost", "nope"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void updateProgress_doesNotRecreateJobDeletedAfterItWasRead() {
        // Given
        lifecycle.markProcessing("j1", 10, "start");
        InMemoryJobStore racingStore = new DeletingOnReadJobStore();
        racingStore.put(store.get("j1").orElseThrow());
        JobLifecycleManager racingLifecycle = new JobLifecycleManager(racingStore, clock);

        // When / Then
        assertThatThrownBy(() -> racingLifecycle.updateProgress("j1", 70, "halfway"))
                .isInstanceOf(JobNotFoundException.class);
        assertThat(racingStore.get("j1")).isEmpty();
    }

    @Test
    void complete_removesResultWhenJobWriteFails() {
        // Given
        InMemoryJobStore failingStore = new InMemoryJobStore(new OcrProcessingConfig(), clock) {
            @Override
            public boolean replace(Job job) {
                if (job.getStatus() == JobStatus.COMPLETED) {
                    throw new JobStoreException("Job store operation failed: replace job " + job.getId(),
                                                new IllegalStateException("connection reset"));
                }
                return super.replace(job);
            }
        };
        failingStore.put(store.get("j1").orElseThrow());
        JobLifecycleManager failingLifecycle = new JobLifecycleManager(failingStore, clock);
        failingLifecycle.markProcessing("j1", 10, "start");

        // When / Then
        assertThatThrownBy(() -> failingLifecycle.complete("j1", JobResult.builder().jobId("j1").build()))
                .isInstanceOf(JobStoreException.class);
        assertThat(failingStore.getResult("j1")).isEmpty();
        assertThat(failingStore.get("j1")).get().extracting(Job::getStatus).isEqualTo(JobStatus.PROCESSING);
    }

    /**
     * Deletes a job right after handing it out, as a concurrent DELETE would between a read and the next write.
     */
    private class DeletingOnReadJobStore extends InMemoryJobStore {

        DeletingOnReadJobStore() {
            super(new OcrProcessingConfig(), clock);
        }

        @Override
        public Optional<Job> get(String jobId) {
            Optional<Job> job = super.get(jobId);
            job.ifPresent(ignored -> delete(jobId));
            return job;
        }
    }
}
