package com.eyelevel.ocrprocessor.service.extraction.ocr;

import com.eyelevel.ocrprocessor.common.processexec.ProcessExecutor;
import com.eyelevel.ocrprocessor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.ExtractionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TesseractOcrEngineTest {

    private static final Path IMAGE = Path.of("/data/scan.png");

    @Mock
    private ProcessExecutor processExecutor;

    private OcrProcessingConfig config;
    private TesseractOcrEngine engine;

    @BeforeEach
    void setUp() {
        config = new OcrProcessingConfig();
        config.getOcr().setCommand("tesseract");
        config.getOcr().setLanguage("eng");
        config.getOcr().setTimeoutMinutes(3);
        engine = new TesseractOcrEngine(config, processExecutor);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void recognize_returnsTrimmedStdout() throws Exception {
        // Given
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(0, "  Hello\nWorld \n", ""));

        // When
        String text = engine.recognize(IMAGE, "job-1");

        // Then
        assertThat(text).isEqualTo("Hello\nWorld");
        verify(processExecutor).execute(
                eq(List.of("tesseract", IMAGE.toAbsolutePath().toString(), "stdout", "-l", "eng")),
                eq("job-1"), eq(3L), eq("tesseract"));
    }

    @Test
    void recognize_omitsLanguageWhenNotConfigured() throws Exception {
        // Given
        config.getOcr().setLanguage(null);
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(0, "text", ""));

        // When
        engine.recognize(IMAGE, "job-1");

        // Then
        verify(processExecutor).execute(eq(List.of("tesseract", IMAGE.toAbsolutePath().toString(), "stdout")),
                anyString(), anyLong(), anyString());
    }

    @Test
    void recognize_nonZeroExitIsAnExtractionError() throws Exception {
        // Given
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(1, "", "Error in pixReadStream"));

        // When / Then
        assertThatThrownBy(() -> engine.recognize(IMAGE, "job-1"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("exit code 1")
                .hasMessageContaining("Error in pixReadStream");
    }

    @Test
    void recognize_wrapsLaunchFailures() throws Exception {
        // Given
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenThrow(new IOException("Cannot run program \"tesseract\""));

        // When / Then
        assertThatThrownBy(() -> engine.recognize(IMAGE, "job-1"))
                .isInstanceOf(ExtractionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void recognize_restoresInterruptFlag() throws Exception {
        // Given
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenThrow(new InterruptedException());

        // When / Then
        assertThatThrownBy(() -> engine.recognize(IMAGE, "job-1"))
                .isInstanceOf(ExtractionException.class)
                .hasCauseInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
