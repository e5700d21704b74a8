package com.eyelevel.ocrprocessor.exception;

import java.io.Serial;

/**
 * Thrown when the job store cannot be reached or rejects a read or write.
 */
public class JobStoreException extends OcrProcessingException {
    @Serial
    private static final long serialVersionUID = -2214395876613482741L;

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
