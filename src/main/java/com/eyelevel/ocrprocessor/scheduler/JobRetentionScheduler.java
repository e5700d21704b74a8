package com.eyelevel.ocrprocessor.scheduler;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.service.job.JobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * A scheduler that removes jobs older than the retention window from the job store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobRetentionScheduler {

    private final JobService jobService;
    private final OcrProcessingConfig config;

    /**
     * Periodically sweeps jobs (and their results) whose creation time is older than the configured
     * retention window. Store entries also expire on their own; the sweep keeps the retention index in step.
     */
    @Scheduled(cron = "${app.scheduler.job-retention}")
    public void sweepExpiredJobs() {
        log.info("Running job retention sweep. Retention window: {}.", config.getRetention());
        try {
            final int removed = jobService.cleanup();
            log.info("Finished job retention sweep. Removed {} jobs.", removed);
        } catch (RuntimeException e) {
            log.error("Job retention sweep failed. It will be retried on the next run.", e);
        }
    }
}
