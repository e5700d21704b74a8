package com.eyelevel.ocrprocessor.service.extraction;

import com.eyelevel.ocrprocessor.exception.ExtractionException;
import com.eyelevel.ocrprocessor.model.FileCategory;

import java.nio.file.Path;

/**
 * Defines the contract for the content extraction routine of one {@link FileCategory}.
 * <p>
 * Implementations own all parsing logic. They should tolerate partial failures internally (for example a
 * single page whose OCR fails) and only throw when no meaningful output can be produced.
 */
public interface ExtractionCapability {

    /**
     * @return The category this capability extracts.
     */
    FileCategory category();

    /**
     * Extracts ordered text fragments and table HTML fragments from a file.
     *
     * @param file           The source document.
     * @param imageOutputDir Directory that receives page or slide raster images, for categories that emit them.
     *                       Must exist.
     * @return The extracted fragments, in document order.
     * @throws ExtractionException if the document cannot be processed at all.
     */
    ExtractionOutput extract(Path file, Path imageOutputDir) throws ExtractionException;
}
