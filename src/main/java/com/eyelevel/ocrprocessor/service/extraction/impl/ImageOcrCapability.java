package com.eyelevel.ocrprocessor.service.extraction.impl;

import com.eyelevel.ocrprocessor.exception.ExtractionException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionCapability;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionOutput;
import com.eyelevel.ocrprocessor.service.extraction.ocr.OcrEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs OCR over a single image and returns the recognized text as one fragment.
 */
@Slf4j
@RequiredArgsConstructor
@Component("imageOcrCapability")
public class ImageOcrCapability implements ExtractionCapability {

    private final OcrEngine ocrEngine;

    @Override
    public FileCategory category() {
        return FileCategory.IMAGE;
    }

    @Override
    public ExtractionOutput extract(Path file, Path imageOutputDir) throws ExtractionException {
        final String text = ocrEngine.recognize(file, file.getFileName().toString());
        log.debug("OCR of image '{}' produced {} characters.", file.getFileName(), text.length());
        return ExtractionOutput.textOnly(text);
    }
}
