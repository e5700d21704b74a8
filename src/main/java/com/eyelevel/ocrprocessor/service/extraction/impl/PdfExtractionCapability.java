package com.eyelevel.ocrprocessor.service.extraction.impl;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.ExtractionException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionCapability;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionOutput;
import com.eyelevel.ocrprocessor.service.extraction.ocr.OcrEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the native text layer of a PDF page by page with PDFBox, then renders every page to
 * {@code page_<N>.png} and appends its OCR text as {@code "Page <N> (OCR): <text>"}.
 * <p>
 * Scanned pages have no text layer, so the OCR pass is what makes them searchable. A page that fails to
 * render or OCR is skipped. Table detection is not performed.
 */
@Slf4j
@RequiredArgsConstructor
@Component("pdfExtractionCapability")
public class PdfExtractionCapability implements ExtractionCapability {

    public static final String OCR_PAGE_FORMAT = "Page %d (OCR): %s";

    private final OcrProcessingConfig config;
    private final OcrEngine ocrEngine;

    @Override
    public FileCategory category() {
        return FileCategory.PDF;
    }

    @Override
    public ExtractionOutput extract(Path file, Path imageOutputDir) throws ExtractionException {
        final String fileName = file.getFileName().toString();
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            final int pageCount = document.getNumberOfPages();
            log.info("Extracting {} page(s) from PDF '{}'.", pageCount, fileName);

            final List<String> texts = new ArrayList<>(extractNativeText(document, pageCount));
            texts.addAll(renderAndOcrPages(document, pageCount, imageOutputDir, fileName));
            return new ExtractionOutput(texts, List.of());
        } catch (IOException e) {
            throw new ExtractionException("Failed to read PDF '" + fileName + "': " + e.getMessage(), e);
        }
    }

    private List<String> extractNativeText(PDDocument document, int pageCount) throws IOException {
        final PDFTextStripper stripper = new PDFTextStripper();
        final List<String> texts = new ArrayList<>();
        for (int page = 1; page <= pageCount; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            final String pageText = stripper.getText(document);
            if (StringUtils.hasText(pageText)) {
                texts.add(pageText.trim());
            }
        }
        return texts;
    }

    private List<String> renderAndOcrPages(PDDocument document, int pageCount, Path imageOutputDir, String fileName) {
        final PDFRenderer renderer = new PDFRenderer(document);
        final float dpi = config.getPdf().getRenderDpi();
        final List<String> texts = new ArrayList<>();

        for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
            final int pageNumber = pageIndex + 1;
            final Path pageImage = imageOutputDir.resolve("page_" + pageNumber + ".png");
            try {
                final BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
                ImageIO.write(image, "png", pageImage.toFile());
                final String ocrText = ocrEngine.recognize(pageImage, fileName + "#" + pageNumber);
                if (StringUtils.hasText(ocrText)) {
                    texts.add(String.format(OCR_PAGE_FORMAT, pageNumber, ocrText.trim()));
                }
            } catch (IOException | ExtractionException e) {
                log.warn("Skipping page {} of '{}': {}", pageNumber, fileName, e.getMessage());
            }
        }
        return texts;
    }
}
