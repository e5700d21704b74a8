package com.eyelevel.ocrprocessor.controller;

import com.eyelevel.ocrprocessor.dto.common.ApiResponse;
import com.eyelevel.ocrprocessor.model.Job;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

@Tag(name = "Process", description = "Endpoints for uploading a document and starting asynchronous extraction.")
public interface ProcessingApi {

    String OPTIONS_DESCRIPTION = "Optional JSON processing options, e.g. {\"output_format\":\"files\"}. Invalid options fall back to the defaults.";

    @Operation(summary = "Process a file with automatic format detection",
            description = "Uploads a PNG, JPEG, PDF, PPTX or PPT file and starts extraction. Returns the pending job to poll.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job created and scheduled.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "File accepted for processing.",
                                        "response": {
                                            "id": "3f0c1b7e-8d1a-4a55-9a51-2f1f0c6f3f7e",
                                            "fileName": "scan.png",
                                            "category": "image",
                                            "status": "pending",
                                            "progress": 0,
                                            "message": "Job created",
                                            "createdAt": "2024-05-01T10:15:30Z",
                                            "updatedAt": "2024-05-01T10:15:30Z"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unsupported file type or missing file.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service Unavailable - Job store unreachable or executor saturated.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Job>> processAuto(
            @Parameter(description = "The document to process.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = OPTIONS_DESCRIPTION)
            @RequestParam(value = "options", required = false) String options);

    @Operation(summary = "Process an image file", description = "Uploads a PNG or JPEG image for OCR text extraction.")
    ResponseEntity<ApiResponse<Job>> processImage(
            @Parameter(description = "A PNG or JPEG image.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = OPTIONS_DESCRIPTION)
            @RequestParam(value = "options", required = false) String options);

    @Operation(summary = "Process a PDF file", description = "Uploads a PDF for text extraction and page OCR.")
    ResponseEntity<ApiResponse<Job>> processPdf(
            @Parameter(description = "A PDF document.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = OPTIONS_DESCRIPTION)
            @RequestParam(value = "options", required = false) String options);

    @Operation(summary = "Process a slide deck", description = "Uploads a PPTX or PPT deck for text, table and image extraction.")
    ResponseEntity<ApiResponse<Job>> processSlideDeck(
            @Parameter(description = "A PPTX or PPT slide deck.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = OPTIONS_DESCRIPTION)
            @RequestParam(value = "options", required = false) String options);
}
