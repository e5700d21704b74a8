package com.eyelevel.ocrprocessor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an extracted fragment came from.
 */
public enum FragmentSource {
    /** OCR text of a standalone image upload. */
    IMAGE("image"),
    /** Text extracted natively from a PDF. */
    TEXT("text"),
    /** OCR text of a rendered PDF page. */
    OCR("ocr"),
    /** A table found in a PDF. */
    PDF("pdf"),
    /** A rendered PDF page image. */
    PAGE("page"),
    /** Text, tables and pictures of a slide deck. */
    SLIDE("slide");

    private final String value;

    FragmentSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FragmentSource fromValue(String value) {
        for (FragmentSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown fragment source: " + value);
    }
}
