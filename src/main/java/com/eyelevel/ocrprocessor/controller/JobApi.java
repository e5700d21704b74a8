package com.eyelevel.ocrprocessor.controller;

import com.eyelevel.ocrprocessor.dto.common.ApiResponse;
import com.eyelevel.ocrprocessor.dto.job.CleanupResponse;
import com.eyelevel.ocrprocessor.dto.job.CreateJobRequest;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;

@Tag(name = "Jobs", description = "Endpoints for polling job status, retrieving results and managing stored jobs.")
public interface JobApi {

    @Operation(summary = "Create Job",
            description = "Creates a pending job record without uploading a file. The category is resolved from the file extension when omitted.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing file name or unsupported file type.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Job>> createJob(@Valid @RequestBody CreateJobRequest request);

    @Operation(summary = "Get Job Status",
            description = "Returns the current status, progress and latest message of a job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Processing", value = """
                                    {
                                        "response": {
                                            "id": "3f0c1b7e-8d1a-4a55-9a51-2f1f0c6f3f7e",
                                            "fileName": "report.pdf",
                                            "category": "pdf",
                                            "status": "processing",
                                            "progress": 70,
                                            "message": "Processing PDF pages",
                                            "createdAt": "2024-05-01T10:15:30Z",
                                            "updatedAt": "2024-05-01T10:15:42Z"
                                        },
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown or expired job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Job>> getJobStatus(
            @Parameter(description = "The job id returned on submission.", required = true)
            @PathVariable String jobId);

    @Operation(summary = "Get Job Result",
            description = "Returns the extracted texts, tables and images of a completed job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Result returned.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "The job is still pending or processing; the current progress is returned.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The job failed; the failure message is returned.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown or expired job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobResult>> getJobResult(
            @Parameter(description = "The job id returned on submission.", required = true)
            @PathVariable String jobId);

    @Operation(summary = "Delete Job",
            description = "Deletes a job, its result and any files written for it. A running job is not interrupted.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job deleted.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown or expired job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Void>> deleteJob(
            @Parameter(description = "The job id returned on submission.", required = true)
            @PathVariable String jobId);

    @Operation(summary = "Clean Up Expired Jobs",
            description = "Runs the retention sweep immediately and removes every job older than the retention window.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Sweep completed.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Cleaned up 3 old jobs",
                                        "response": {
                                            "message": "Cleaned up 3 old jobs",
                                            "jobsRemoved": 3
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """)))
    })
    ResponseEntity<ApiResponse<CleanupResponse>> cleanupJobs();
}
