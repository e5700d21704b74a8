package com.eyelevel.ocrprocessor.service.handlers.impl;

import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.FragmentSource;
import com.eyelevel.ocrprocessor.model.ImageReference;
import com.eyelevel.ocrprocessor.model.TextFragment;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionCapability;
import com.eyelevel.ocrprocessor.service.handlers.FragmentTagger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class PdfCategoryHandler extends AbstractDocumentCategoryHandler {

    public PdfCategoryHandler(@Qualifier("pdfExtractionCapability") ExtractionCapability capability) {
        super(capability);
    }

    @Override
    public FileCategory category() {
        return FileCategory.PDF;
    }

    @Override
    protected String extractingMessage() {
        return "Extracting text and tables from PDF";
    }

    @Override
    protected String processingMessage() {
        return "Processing PDF pages";
    }

    @Override
    protected String completedMessage() {
        return "PDF processing completed, preparing results";
    }

    @Override
    protected TextFragment tagText(String text) {
        return FragmentTagger.tagPdfText(text);
    }

    @Override
    protected FragmentSource tableSource() {
        return FragmentSource.PDF;
    }

    @Override
    protected ImageReference tagImage(Path image) {
        final String name = image.getFileName().toString();
        return FragmentTagger.isPageImage(name) ? FragmentTagger.tagPageImage(image.toString(), name) : null;
    }
}
