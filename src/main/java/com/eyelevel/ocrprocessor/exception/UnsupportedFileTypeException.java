package com.eyelevel.ocrprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a file's extension does not map to any supported category. Always a client error.
 */
public class UnsupportedFileTypeException extends OcrProcessingException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public UnsupportedFileTypeException(String message) {
        super(message);
    }
}
