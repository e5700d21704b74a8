package com.eyelevel.ocrprocessor.service.handlers.impl;

import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.FragmentSource;
import com.eyelevel.ocrprocessor.model.TextFragment;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionCapability;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionOutput;
import com.eyelevel.ocrprocessor.service.handlers.CategoryHandler;
import com.eyelevel.ocrprocessor.service.handlers.HandledContent;
import com.eyelevel.ocrprocessor.service.handlers.HandlerContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * OCRs a single image into one text fragment and a {@code <base>.txt} artifact.
 */
@Component
@Slf4j
public class ImageCategoryHandler implements CategoryHandler {

    private final ExtractionCapability capability;

    public ImageCategoryHandler(@Qualifier("imageOcrCapability") ExtractionCapability capability) {
        this.capability = capability;
    }

    @Override
    public FileCategory category() {
        return FileCategory.IMAGE;
    }

    @Override
    public HandledContent handle(HandlerContext context) throws IOException {
        context.report(30, "Applying OCR to image");

        final ExtractionOutput output = capability.extract(context.getFilePath(), context.getWorkingDir());
        final String text = String.join("\n", output.texts());

        final Path textFile = context.getWorkingDir().resolve(FilenameUtils.getBaseName(context.getFileName()) + ".txt");
        Files.writeString(textFile, text, StandardCharsets.UTF_8);
        log.debug("[JobId: {}] Wrote OCR text to '{}'.", context.getJobId(), textFile);

        context.report(90, "OCR completed, preparing results");
        return HandledContent.builder()
                .text(new TextFragment(text, FragmentSource.IMAGE, null))
                .outputFile("text", textFile.toString())
                .build();
    }
}
