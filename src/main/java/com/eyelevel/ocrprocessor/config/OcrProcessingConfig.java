package com.eyelevel.ocrprocessor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. This provides centralized control over job retention, storage
 * and the external extraction tools.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class OcrProcessingConfig {

    /**
     * How long job metadata and results are kept after their last write.
     */
    private Duration retention = Duration.ofHours(24);

    /**
     * Directory where uploaded source files are stored before dispatch.
     */
    private Path uploadDir = Path.of("uploads");

    /**
     * Root directory for materialized results when the "files" output format is requested.
     */
    private Path outputDir = Path.of("parsed_docs");

    private Store store = new Store();
    private Executor executor = new Executor();
    private Ocr ocr = new Ocr();
    private Pdf pdf = new Pdf();
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Store {
        /**
         * Either {@code redis} (default) or {@code memory}.
         */
        private String type = "redis";
        private String keyPrefix = "ocr";
    }

    @Data
    public static class Executor {
        private int coreSize = 4;
        private int maxSize = 8;
        private int queueCapacity = 100;
    }

    @Data
    public static class Ocr {
        private String command = "tesseract";
        private String language;
        private long timeoutMinutes = 5;
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class Pdf {
        private float renderDpi = 200f;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int windowSeconds = 60;
        private int maxRequests = 100;
    }
}
