package com.eyelevel.ocrprocessor.service.handlers.impl;

import com.eyelevel.ocrprocessor.model.FragmentSource;
import com.eyelevel.ocrprocessor.model.ImageReference;
import com.eyelevel.ocrprocessor.model.TableFragment;
import com.eyelevel.ocrprocessor.model.TextFragment;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionCapability;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionOutput;
import com.eyelevel.ocrprocessor.service.handlers.CategoryHandler;
import com.eyelevel.ocrprocessor.service.handlers.HandledContent;
import com.eyelevel.ocrprocessor.service.handlers.HandlerContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Shared pipeline of the multi-page categories. Raster images go to {@code <working>/<base>/}, text to
 * {@code <base>.txt} and tables to {@code <base>_tables.html}; subclasses decide the messages and how the
 * fragments and images are tagged.
 */
@Slf4j
public abstract class AbstractDocumentCategoryHandler implements CategoryHandler {

    private static final String FRAGMENT_SEPARATOR = "\n\n";

    private final ExtractionCapability capability;

    protected AbstractDocumentCategoryHandler(ExtractionCapability capability) {
        this.capability = capability;
    }

    protected abstract String extractingMessage();

    protected abstract String processingMessage();

    protected abstract String completedMessage();

    protected abstract TextFragment tagText(String text);

    protected abstract FragmentSource tableSource();

    /**
     * @return the tagged image, or {@code null} if the file is not one of this category's images.
     */
    protected abstract ImageReference tagImage(Path image);

    @Override
    public HandledContent handle(HandlerContext context) throws IOException {
        final String baseName = FilenameUtils.getBaseName(context.getFileName());
        final Path imagesDir = Files.createDirectories(context.getWorkingDir().resolve(baseName));

        context.report(30, extractingMessage());
        final ExtractionOutput output = capability.extract(context.getFilePath(), imagesDir);
        log.info("[JobId: {}] Extracted {} text fragment(s) and {} table(s).", context.getJobId(),
                 output.texts().size(), output.tablesHtml().size());

        final Path textFile = context.getWorkingDir().resolve(baseName + ".txt");
        final Path tablesFile = context.getWorkingDir().resolve(baseName + "_tables.html");
        context.report(70, processingMessage());
        writeFragments(textFile, output.texts().stream().map(String::trim).toList());
        writeFragments(tablesFile, output.tablesHtml());

        context.report(90, completedMessage());
        final HandledContent.HandledContentBuilder content = HandledContent.builder()
                .outputFile("text", textFile.toString())
                .outputFile("tables", tablesFile.toString())
                .outputFile("images_dir", imagesDir.toString());
        output.texts().forEach(text -> content.text(tagText(text)));
        output.tablesHtml().forEach(html -> content.table(new TableFragment(html, tableSource(), null)));
        listImages(imagesDir).forEach(content::image);
        return content.build();
    }

    private void writeFragments(Path target, List<String> fragments) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (String fragment : fragments) {
                writer.write(fragment);
                writer.write(FRAGMENT_SEPARATOR);
            }
        }
    }

    private List<ImageReference> listImages(Path imagesDir) throws IOException {
        try (Stream<Path> files = Files.list(imagesDir)) {
            return files.filter(Files::isRegularFile)
                    .sorted()
                    .map(this::tagImage)
                    .filter(Objects::nonNull)
                    .toList();
        }
    }
}
