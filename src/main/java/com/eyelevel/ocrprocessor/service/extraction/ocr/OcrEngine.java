package com.eyelevel.ocrprocessor.service.extraction.ocr;

import com.eyelevel.ocrprocessor.exception.ExtractionException;

import java.nio.file.Path;

/**
 * Recognizes text in a raster image.
 */
public interface OcrEngine {

    /**
     * @param image       A PNG or JPEG image.
     * @param contextInfo Logging context, such as the job id.
     * @return The recognized text, trimmed. Empty if the image contains no text.
     * @throws ExtractionException if the engine could not be run or reported an error.
     */
    String recognize(Path image, String contextInfo) throws ExtractionException;
}
