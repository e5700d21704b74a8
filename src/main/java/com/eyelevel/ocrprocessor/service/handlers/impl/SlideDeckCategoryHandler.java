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
public class SlideDeckCategoryHandler extends AbstractDocumentCategoryHandler {

    public SlideDeckCategoryHandler(@Qualifier("slideDeckExtractionCapability") ExtractionCapability capability) {
        super(capability);
    }

    @Override
    public FileCategory category() {
        return FileCategory.SLIDE_DECK;
    }

    @Override
    protected String extractingMessage() {
        return "Extracting content from slide deck";
    }

    @Override
    protected String processingMessage() {
        return "Processing slides";
    }

    @Override
    protected String completedMessage() {
        return "Slide deck processing completed, preparing results";
    }

    @Override
    protected TextFragment tagText(String text) {
        return new TextFragment(text, FragmentSource.SLIDE, null);
    }

    @Override
    protected FragmentSource tableSource() {
        return FragmentSource.SLIDE;
    }

    @Override
    protected ImageReference tagImage(Path image) {
        final String name = image.getFileName().toString();
        return FragmentTagger.isSlideImage(name) ? FragmentTagger.tagSlideImage(image.toString(), name) : null;
    }
}
