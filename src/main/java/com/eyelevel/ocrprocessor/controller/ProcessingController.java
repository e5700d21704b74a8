package com.eyelevel.ocrprocessor.controller;

import com.eyelevel.ocrprocessor.common.json.JsonParser;
import com.eyelevel.ocrprocessor.dto.common.ApiResponse;
import com.eyelevel.ocrprocessor.dto.job.ProcessingOptions;
import com.eyelevel.ocrprocessor.exception.OcrProcessingException;
import com.eyelevel.ocrprocessor.exception.json.JsonParsingException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.service.job.JobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * REST controller for uploading documents. Each endpoint stores the upload, creates a job and schedules
 * it for background extraction, returning the pending job immediately.
 */
@Slf4j
@RestController
@RequestMapping(value = "/api/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
@RequiredArgsConstructor
public class ProcessingController implements ProcessingApi {

    private final JobService jobService;
    private final JsonParser jsonParser;

    @Override
    @PostMapping
    public ResponseEntity<ApiResponse<Job>> processAuto(@RequestPart("file") final MultipartFile file,
                                                        @RequestParam(value = "options", required = false) final String options) {
        return submit(file, null, options);
    }

    @Override
    @PostMapping("/image")
    public ResponseEntity<ApiResponse<Job>> processImage(@RequestPart("file") final MultipartFile file,
                                                         @RequestParam(value = "options", required = false) final String options) {
        return submit(file, FileCategory.IMAGE, options);
    }

    @Override
    @PostMapping("/pdf")
    public ResponseEntity<ApiResponse<Job>> processPdf(@RequestPart("file") final MultipartFile file,
                                                       @RequestParam(value = "options", required = false) final String options) {
        return submit(file, FileCategory.PDF, options);
    }

    @Override
    @PostMapping("/pptx")
    public ResponseEntity<ApiResponse<Job>> processSlideDeck(@RequestPart("file") final MultipartFile file,
                                                             @RequestParam(value = "options", required = false) final String options) {
        return submit(file, FileCategory.SLIDE_DECK, options);
    }

    private ResponseEntity<ApiResponse<Job>> submit(final MultipartFile file, final FileCategory category,
                                                    final String rawOptions) {
        final String fileName = file.getOriginalFilename();
        log.info("Received upload: {} ({} bytes), category: {}", fileName, file.getSize(),
                 category == null ? "auto" : category.getValue());

        final Job job;
        try (InputStream content = file.getInputStream()) {
            job = jobService.submit(fileName, content, category, parseOptions(rawOptions));
        } catch (IOException e) {
            throw new OcrProcessingException("Error reading uploaded file: " + e.getMessage(), e);
        }

        ApiResponse<Job> response = ApiResponse.<Job>builder()
                .response(job)
                .displayMessage("File accepted for processing.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    private ProcessingOptions parseOptions(final String rawOptions) {
        if (!StringUtils.hasText(rawOptions)) {
            return ProcessingOptions.defaults();
        }
        try {
            final ProcessingOptions options = jsonParser.parseObject(rawOptions, ProcessingOptions.class);
            return options != null ? options : ProcessingOptions.defaults();
        } catch (JsonParsingException e) {
            log.warn("Ignoring invalid processing options '{}': {}", rawOptions, e.getMessage());
            return ProcessingOptions.defaults();
        }
    }
}
