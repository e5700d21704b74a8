package com.eyelevel.ocrprocessor.exception;

import java.io.Serial;

/**
 * Thrown when an extraction capability (OCR, PDF or slide-deck extraction) cannot produce output.
 */
public class ExtractionException extends OcrProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
