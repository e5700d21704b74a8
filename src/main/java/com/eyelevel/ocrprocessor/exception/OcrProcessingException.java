package com.eyelevel.ocrprocessor.exception;

import java.io.Serial;

/**
 * A base exception for errors raised by the job engine and its extraction pipeline.
 */
public class OcrProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public OcrProcessingException(String message) {
        super(message);
    }

    public OcrProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
