package com.eyelevel.ocrprocessor.service.extraction;

import java.util.List;

/**
 * What an {@link ExtractionCapability} returns: text runs and HTML tables, each in document order.
 */
public record ExtractionOutput(List<String> texts, List<String> tablesHtml) {

    public ExtractionOutput {
        texts = texts == null ? List.of() : List.copyOf(texts);
        tablesHtml = tablesHtml == null ? List.of() : List.copyOf(tablesHtml);
    }

    public static ExtractionOutput textOnly(String text) {
        return new ExtractionOutput(List.of(text), List.of());
    }
}
