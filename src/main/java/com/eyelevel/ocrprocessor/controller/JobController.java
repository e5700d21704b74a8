package com.eyelevel.ocrprocessor.controller;

import com.eyelevel.ocrprocessor.dto.common.ApiResponse;
import com.eyelevel.ocrprocessor.dto.job.CleanupResponse;
import com.eyelevel.ocrprocessor.dto.job.CreateJobRequest;
import com.eyelevel.ocrprocessor.exception.UnsupportedFileTypeException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import com.eyelevel.ocrprocessor.service.file.FileTypeResolver;
import com.eyelevel.ocrprocessor.service.job.JobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for job status polling, result retrieval and job housekeeping.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController implements JobApi {

    private final JobService jobService;
    private final FileTypeResolver fileTypeResolver;

    @Override
    @PostMapping
    public ResponseEntity<ApiResponse<Job>> createJob(@Valid @RequestBody final CreateJobRequest request) {
        final FileCategory category = StringUtils.hasText(request.getCategory())
                ? FileCategory.fromValue(request.getCategory())
                        .orElseThrow(() -> new UnsupportedFileTypeException("Unknown category: " + request.getCategory()))
                : fileTypeResolver.require(request.getFileName());
        log.info("Creating job for file: {}, category: {}", request.getFileName(), category.getValue());

        final Job job = jobService.create(request.getFileName(), category);

        ApiResponse<Job> response = ApiResponse.<Job>builder()
                .response(job)
                .displayMessage("Job created successfully.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Job>> getJobStatus(
            @PathVariable final String jobId) {
        log.debug("Fetching status for jobId: {}", jobId);
        return ResponseEntity.ok(ApiResponse.success(jobService.status(jobId)));
    }

    @Override
    @GetMapping("/{jobId}/result")
    public ResponseEntity<ApiResponse<JobResult>> getJobResult(
            @PathVariable final String jobId) {
        log.debug("Fetching result for jobId: {}", jobId);
        return ResponseEntity.ok(ApiResponse.success(jobService.result(jobId)));
    }

    @Override
    @DeleteMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Void>> deleteJob(
            @PathVariable final String jobId) {
        log.info("Received request to delete jobId: {}", jobId);
        jobService.delete(jobId);

        ApiResponse<Void> response = ApiResponse.<Void>builder()
                .displayMessage(String.format("Job %s deleted", jobId))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @PostMapping("/cleanup")
    public ResponseEntity<ApiResponse<CleanupResponse>> cleanupJobs() {
        log.info("Received request to clean up expired jobs.");
        final int removed = jobService.cleanup();
        final String message = String.format("Cleaned up %d old jobs", removed);

        ApiResponse<CleanupResponse> response = ApiResponse.<CleanupResponse>builder()
                .response(new CleanupResponse(message, removed))
                .displayMessage(message)
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }
}
