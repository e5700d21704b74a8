package com.eyelevel.ocrprocessor.service.extraction.impl;

import com.eyelevel.ocrprocessor.exception.ExtractionException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionCapability;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionOutput;
import com.eyelevel.ocrprocessor.service.extraction.ocr.OcrEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.sl.usermodel.PictureShape;
import org.apache.poi.sl.usermodel.Shape;
import org.apache.poi.sl.usermodel.Slide;
import org.apache.poi.sl.usermodel.SlideShow;
import org.apache.poi.sl.usermodel.SlideShowFactory;
import org.apache.poi.sl.usermodel.TableCell;
import org.apache.poi.sl.usermodel.TableShape;
import org.apache.poi.sl.usermodel.TextShape;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks the top-level shapes of every slide of a {@code .pptx} or {@code .ppt} deck with Apache POI.
 * Text shapes contribute text, tables are rendered as HTML, and pictures are written as
 * {@code slide<S>_img<K>.<ext>} and OCR'd when they are in a raster format.
 */
@Slf4j
@RequiredArgsConstructor
@Component("slideDeckExtractionCapability")
public class SlideDeckExtractionCapability implements ExtractionCapability {

    private static final Set<String> RASTER_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "bmp", "tif", "tiff");

    private final OcrEngine ocrEngine;

    @Override
    public FileCategory category() {
        return FileCategory.SLIDE_DECK;
    }

    @Override
    public ExtractionOutput extract(Path file, Path imageOutputDir) throws ExtractionException {
        final String fileName = file.getFileName().toString();
        final List<String> texts = new ArrayList<>();
        final List<String> tables = new ArrayList<>();

        try (SlideShow<?, ?> slideShow = SlideShowFactory.create(file.toFile())) {
            int slideIndex = 0;
            for (Slide<?, ?> slide : slideShow.getSlides()) {
                slideIndex++;
                int shapeIndex = 0;
                for (Shape<?, ?> shape : slide.getShapes()) {
                    shapeIndex++;
                    if (shape instanceof TableShape) {
                        tables.add(toHtml((TableShape<?, ?>) shape));
                    } else if (shape instanceof TextShape) {
                        final String text = ((TextShape<?, ?>) shape).getText();
                        if (StringUtils.hasText(text)) {
                            texts.add(text.trim());
                        }
                    } else if (shape instanceof PictureShape) {
                        final String ocrText = savePicture((PictureShape<?, ?>) shape, slideIndex, shapeIndex,
                                imageOutputDir, fileName);
                        if (StringUtils.hasText(ocrText)) {
                            texts.add(ocrText);
                        }
                    }
                }
            }
            log.info("Extracted {} slide(s) from '{}': {} text fragment(s), {} table(s).",
                    slideIndex, fileName, texts.size(), tables.size());
            return new ExtractionOutput(texts, tables);
        } catch (IOException | EncryptedDocumentException e) {
            throw new ExtractionException("Failed to read slide deck '" + fileName + "': " + e.getMessage(), e);
        }
    }

    /**
     * Writes the picture to disk and returns its OCR text, or {@code null} if it was not OCR'd.
     */
    private String savePicture(PictureShape<?, ?> picture, int slideIndex, int shapeIndex, Path imageOutputDir,
                               String fileName) {
        final PictureData data = picture.getPictureData();
        if (data == null) {
            return null;
        }
        final String extension = extensionOf(data);
        final Path target = imageOutputDir.resolve("slide" + slideIndex + "_img" + shapeIndex + "." + extension);
        try {
            Files.write(target, data.getData());
            if (!RASTER_EXTENSIONS.contains(extension)) {
                log.debug("Skipping OCR for non-raster picture '{}'.", target.getFileName());
                return null;
            }
            return ocrEngine.recognize(target, fileName + "#slide" + slideIndex);
        } catch (IOException | ExtractionException e) {
            log.warn("Skipping picture {} on slide {} of '{}': {}", shapeIndex, slideIndex, fileName, e.getMessage());
            return null;
        }
    }

    private String extensionOf(PictureData data) {
        final String contentType = data.getContentType();
        if (!StringUtils.hasText(contentType) || !contentType.contains("/")) {
            return "bin";
        }
        String subtype = contentType.substring(contentType.indexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (subtype.startsWith("x-")) {
            subtype = subtype.substring(2);
        }
        return subtype;
    }

    private String toHtml(TableShape<?, ?> table) {
        final StringBuilder html = new StringBuilder("<table>");
        for (int row = 0; row < table.getNumberOfRows(); row++) {
            html.append("<tr>");
            for (int col = 0; col < table.getNumberOfColumns(); col++) {
                final TableCell<?, ?> cell = table.getCell(row, col);
                final String text = cell == null || cell.getText() == null ? "" : cell.getText().trim();
                html.append("<td>").append(Entities.escape(text)).append("</td>");
            }
            html.append("</tr>");
        }
        return html.append("</table>").toString();
    }
}
