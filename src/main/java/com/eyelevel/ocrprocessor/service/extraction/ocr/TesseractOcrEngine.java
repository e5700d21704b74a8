package com.eyelevel.ocrprocessor.service.extraction.ocr;

import com.eyelevel.ocrprocessor.common.processexec.ProcessExecutor;
import com.eyelevel.ocrprocessor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.ExtractionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link OcrEngine} that shells out to the {@code tesseract} command-line tool and reads the recognized text
 * from its standard output.
 */
@Slf4j
@RequiredArgsConstructor
@Service("tesseractOcrEngine")
public class TesseractOcrEngine implements OcrEngine {

    private final OcrProcessingConfig config;
    private final ProcessExecutor processExecutor;

    @Override
    @Retryable(retryFor = {ExtractionException.class},
            maxAttemptsExpression = "#{${app.processing.ocr.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.ocr.retry.delay-ms}}"),
            listeners = {"ocrRetryListener"})
    public String recognize(Path image, String contextInfo) throws ExtractionException {
        final long timeout = config.getOcr().getTimeoutMinutes();
        log.debug("[{}] Running OCR on '{}' (Timeout: {}m).", contextInfo, image.getFileName(), timeout);

        try {
            final ProcessResult result = processExecutor.execute(buildCommand(image), contextInfo, timeout, "tesseract");
            if (result.exitCode() != 0) {
                throw new ExtractionException(String.format("OCR failed for '%s' (exit code %d). Error: %s",
                        image.getFileName(), result.exitCode(), result.stderr()));
            }
            return result.stdout().trim();
        } catch (IOException e) {
            throw new ExtractionException("OCR process failed for: " + image.getFileName() + ". " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("OCR was interrupted for: " + image.getFileName(), e);
        }
    }

    private List<String> buildCommand(Path image) {
        final List<String> command = new ArrayList<>();
        command.add(config.getOcr().getCommand());
        command.add(image.toAbsolutePath().toString());
        command.add("stdout");
        if (StringUtils.hasText(config.getOcr().getLanguage())) {
            command.add("-l");
            command.add(config.getOcr().getLanguage());
        }
        return command;
    }
}
