package com.eyelevel.ocrprocessor.controller;

import com.eyelevel.ocrprocessor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.ocrprocessor.dto.job.ProcessingOptions;
import com.eyelevel.ocrprocessor.exception.JobSchedulingException;
import com.eyelevel.ocrprocessor.exception.UnsupportedFileTypeException;
import com.eyelevel.ocrprocessor.exception.handler.GlobalExceptionHandler;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobStatus;
import com.eyelevel.ocrprocessor.model.OutputFormat;
import com.eyelevel.ocrprocessor.service.job.JobService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ProcessingControllerTest {

    private static final MockMultipartFile PNG =
            new MockMultipartFile("file", "scan.png", "image/png", new byte[]{1, 2, 3});

    @Mock
    private JobService jobService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        JacksonJsonParser jsonParser = new JacksonJsonParser(new ObjectMapper().findAndRegisterModules());
        mockMvc = MockMvcBuilders.standaloneSetup(new ProcessingController(jobService, jsonParser))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void processAuto_returnsPendingJob() throws Exception {
        // Given
        when(jobService.submit(eq("scan.png"), any(InputStream.class), isNull(), any(ProcessingOptions.class)))
                .thenReturn(pendingJob());

        // When / Then
        mockMvc.perform(multipart("/api/process").file(PNG))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.id").value("j1"))
                .andExpect(jsonPath("$.response.status").value("pending"));
    }

    @Test
    void processImage_passesCategoryAndParsedOptions() throws Exception {
        // Given
        ArgumentCaptor<ProcessingOptions> options = ArgumentCaptor.forClass(ProcessingOptions.class);
        when(jobService.submit(eq("scan.png"), any(InputStream.class), eq(FileCategory.IMAGE), options.capture()))
                .thenReturn(pendingJob());

        // When
        mockMvc.perform(multipart("/api/process/image").file(PNG).param("options", "{\"output_format\":\"files\"}"))
                .andExpect(status().isOk());

        // Then
        assertThat(options.getValue().getOutputFormat()).isEqualTo(OutputFormat.FILES);
    }

    @Test
    void malformedOptionsFallBackToDefaults() throws Exception {
        // Given
        ArgumentCaptor<ProcessingOptions> options = ArgumentCaptor.forClass(ProcessingOptions.class);
        when(jobService.submit(eq("scan.png"), any(InputStream.class), isNull(), options.capture()))
                .thenReturn(pendingJob());

        // When
        mockMvc.perform(multipart("/api/process").file(PNG).param("options", "{not json"))
                .andExpect(status().isOk());

        // Then
        assertThat(options.getValue().getOutputFormat()).isEqualTo(OutputFormat.JSON);
    }

    @Test
    void processPdf_mismatchedExtensionIsBadRequest() throws Exception {
        // Given
        when(jobService.submit(eq("scan.png"), any(InputStream.class), eq(FileCategory.PDF), any()))
                .thenThrow(new UnsupportedFileTypeException("Invalid file type for pdf processing. Supported: .pdf"));

        // When / Then
        mockMvc.perform(multipart("/api/process/pdf").file(PNG))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.displayMessage").value("Invalid file type for pdf processing. Supported: .pdf"));
    }

    @Test
    void processSlideDeck_usesSlideDeckCategory() throws Exception {
        // Given
        MockMultipartFile deck = new MockMultipartFile("file", "deck.pptx", "application/octet-stream", new byte[]{1});
        when(jobService.submit(eq("deck.pptx"), any(InputStream.class), eq(FileCategory.SLIDE_DECK), any()))
                .thenReturn(pendingJob());

        // When / Then
        mockMvc.perform(multipart("/api/process/pptx").file(deck))
                .andExpect(status().isOk());
        verify(jobService).submit(eq("deck.pptx"), any(InputStream.class), eq(FileCategory.SLIDE_DECK), any());
    }

    @Test
    void missingFilePartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/process"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rejectedScheduleIsServiceUnavailable() throws Exception {
        // Given
        when(jobService.submit(eq("scan.png"), any(InputStream.class), isNull(), any()))
                .thenThrow(new JobSchedulingException("Could not schedule job j1", new RuntimeException("full")));

        // When / Then
        mockMvc.perform(multipart("/api/process").file(PNG))
                .andExpect(status().isServiceUnavailable());
    }

    private static Job pendingJob() {
        return Job.builder().id("j1").fileName("scan.png").category(FileCategory.IMAGE)
                .status(JobStatus.PENDING).progress(0).message("Job created").build();
    }
}
