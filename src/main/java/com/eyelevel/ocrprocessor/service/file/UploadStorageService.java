package com.eyelevel.ocrprocessor.service.file;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.OcrProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Stores uploaded source files on the local filesystem under the configured upload directory. Each upload
 * gets a random prefix so concurrent uploads of the same file name never collide.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadStorageService {

    private final OcrProcessingConfig config;

    /**
     * Copies the upload to {@code <upload-dir>/<random>_<fileName>}.
     *
     * @param originalFileName The client-supplied file name. Any path component is discarded.
     * @param content          The upload content. Not closed by this method.
     * @return The path of the stored file.
     */
    public Path store(final String originalFileName, final InputStream content) {
        final String safeName = FilenameUtils.getName(originalFileName);
        final Path uploadDir = config.getUploadDir();
        final Path target = uploadDir.resolve(UUID.randomUUID().toString().replace("-", "") + "_" + safeName);
        try {
            Files.createDirectories(uploadDir);
            final long bytes = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Stored upload '{}' ({} bytes) at {}", safeName, bytes, target);
            return target;
        } catch (IOException e) {
            log.error("Error saving upload '{}' to {}", safeName, target, e);
            throw new OcrProcessingException("Error saving file: " + e.getMessage(), e);
        }
    }

    /**
     * Deletes a stored upload, logging instead of failing when the file cannot be removed.
     */
    public void discard(final Path storedFile) {
        try {
            Files.deleteIfExists(storedFile);
        } catch (IOException e) {
            log.warn("Failed to delete stored upload {}: {}", storedFile, e.getMessage());
        }
    }
}
