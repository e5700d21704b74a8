package com.eyelevel.ocrprocessor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * The kinds of documents the service can extract content from. Each category owns the file
 * extensions that map to it and is handled by exactly one
 * {@link com.eyelevel.ocrprocessor.service.handlers.CategoryHandler}.
 */
public enum FileCategory {
    IMAGE("image", Set.of("png", "jpg", "jpeg")),
    PDF("pdf", Set.of("pdf")),
    SLIDE_DECK("slide-deck", Set.of("pptx", "ppt"));

    private final String value;
    private final Set<String> extensions;

    FileCategory(String value, Set<String> extensions) {
        this.value = value;
        this.extensions = extensions;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lower-case extensions, without the leading dot.
     */
    public Set<String> getExtensions() {
        return extensions;
    }

    /**
     * Looks a category up by its wire value or enum name. {@code pptx} is accepted as an alias of
     * {@link #SLIDE_DECK} for the category-specific upload endpoint.
     */
    public static Optional<FileCategory> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        final String normalized = value.trim();
        if ("pptx".equalsIgnoreCase(normalized)) {
            return Optional.of(SLIDE_DECK);
        }
        return Arrays.stream(values())
                .filter(category -> category.value.equalsIgnoreCase(normalized)
                        || category.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static FileCategory fromJson(String value) {
        return fromValue(value).orElseThrow(() -> new IllegalArgumentException("Unknown file category: " + value));
    }
}
