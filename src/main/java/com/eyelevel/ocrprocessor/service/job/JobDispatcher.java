package com.eyelevel.ocrprocessor.service.job;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.UnsupportedFileTypeException;
import com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.ImageReference;
import com.eyelevel.ocrprocessor.model.JobResult;
import com.eyelevel.ocrprocessor.model.OutputFormat;
import com.eyelevel.ocrprocessor.service.file.FileTypeResolver;
import com.eyelevel.ocrprocessor.service.file.UploadStorageService;
import com.eyelevel.ocrprocessor.service.handlers.CategoryHandler;
import com.eyelevel.ocrprocessor.service.handlers.HandledContent;
import com.eyelevel.ocrprocessor.service.handlers.HandlerContext;
import com.eyelevel.ocrprocessor.service.handlers.factory.CategoryHandlerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one job from {@code processing} to a terminal status. Runs on the background executor and never
 * lets an exception escape: every failure ends as a {@code failed} job with a
 * {@code "Processing failed: <error>"} message.
 * <p>
 * A job deleted while it runs is not recreated. The next write finds no record and the run stops.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDispatcher {

    public static final String FAILURE_PREFIX = "Processing failed: ";

    private final OcrProcessingConfig config;
    private final JobLifecycleManager lifecycleManager;
    private final FileTypeResolver fileTypeResolver;
    private final CategoryHandlerFactory handlerFactory;
    private final UploadStorageService uploadStorageService;

    public void dispatch(final DispatchRequest request) {
        final String jobId = request.getJobId();
        final boolean inline = request.getOutputFormat() == OutputFormat.JSON;
        Path workingDir = null;

        try {
            lifecycleManager.markProcessing(jobId, 10, "Starting " + describe(request.getCategory()) + " processing");

            final FileCategory category = request.getCategory() != null
                    ? request.getCategory()
                    : fileTypeResolver.require(request.getFileName());
            lifecycleManager.updateProgress(jobId, 20, "Detected file type: " + category.getValue());

            final CategoryHandler handler = handlerFactory.getHandler(category)
                    .orElseThrow(() -> new UnsupportedFileTypeException("Unsupported file type: " + category.getValue()));

            workingDir = allocateWorkingDir(request);
            log.info("[JobId: {}] Processing '{}' as {} in {}", jobId, request.getFileName(), category.getValue(), workingDir);

            final HandledContent content = handler.handle(HandlerContext.builder()
                    .jobId(jobId)
                    .fileName(request.getFileName())
                    .filePath(request.getFilePath())
                    .workingDir(workingDir)
                    .progressReporter((progress, message) -> lifecycleManager.updateProgress(jobId, progress, message))
                    .build());

            lifecycleManager.complete(jobId, assembleResult(request, category, content, workingDir));
        } catch (final JobNotFoundException e) {
            log.warn("[JobId: {}] Job record no longer exists. It was deleted or expired while processing; stopping.", jobId);
        } catch (final Exception e) {
            log.error("[JobId: {}] Processing failed for '{}'.", jobId, request.getFileName(), e);
            recordFailure(jobId, FAILURE_PREFIX + describeError(e));
        } finally {
            if (inline && workingDir != null) {
                deleteWorkingDir(jobId, workingDir);
            }
            if (request.isDiscardSource() && request.getFilePath() != null) {
                uploadStorageService.discard(request.getFilePath());
            }
        }
    }

    private JobResult assembleResult(final DispatchRequest request, final FileCategory category,
                                     final HandledContent content, final Path workingDir) {
        final boolean inline = request.getOutputFormat() == OutputFormat.JSON;

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("outputFormat", request.getOutputFormat().getValue());
        if (!inline) {
            metadata.put("outputDirectory", workingDir.toString());
        }

        final List<ImageReference> images = inline
                ? content.getImages().stream()
                        .map(image -> new ImageReference(relativize(workingDir, image.getPath()), image.getSource(),
                                                         image.getPageNumber()))
                        .toList()
                : content.getImages();

        return JobResult.builder()
                .jobId(request.getJobId())
                .fileName(request.getFileName())
                .category(category)
                .texts(content.getTexts())
                .tables(content.getTables())
                .images(images)
                .outputFiles(inline ? new LinkedHashMap<>() : new LinkedHashMap<>(content.getOutputFiles()))
                .metadata(metadata)
                .build();
    }

    private Path allocateWorkingDir(final DispatchRequest request) throws IOException {
        if (request.getOutputFormat() == OutputFormat.JSON) {
            return Files.createTempDirectory("ocr-" + request.getJobId() + "-");
        }
        final Path outputDir = request.getOutputDir() != null
                ? request.getOutputDir()
                : config.getOutputDir().resolve(request.getJobId());
        return Files.createDirectories(outputDir);
    }

    private void recordFailure(final String jobId, final String message) {
        try {
            lifecycleManager.fail(jobId, message);
        } catch (final JobNotFoundException e) {
            log.warn("[JobId: {}] Job record no longer exists; failure not recorded.", jobId);
        } catch (final RuntimeException e) {
            log.error("CRITICAL: [JobId: {}] Failed to persist FAILED status. The job may stay in progress until swept.",
                      jobId, e);
        }
    }

    private void deleteWorkingDir(final String jobId, final Path workingDir) {
        try {
            FileUtils.deleteDirectory(workingDir.toFile());
            log.debug("[JobId: {}] Removed scratch directory {}", jobId, workingDir);
        } catch (final IOException e) {
            log.error("[JobId: {}] Failed to clean up scratch directory: {}", jobId, workingDir, e);
        }
    }

    private static String relativize(final Path workingDir, final String path) {
        return FilenameUtils.separatorsToUnix(workingDir.relativize(Path.of(path)).toString());
    }

    private static String describe(final FileCategory category) {
        return category == null ? "auto" : category.getValue();
    }

    private static String describeError(final Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
