package com.eyelevel.ocrprocessor.exception;

import java.io.Serial;

/**
 * Thrown when a job could not be handed to the background executor.
 */
public class JobSchedulingException extends OcrProcessingException {
    @Serial
    private static final long serialVersionUID = 7345102290811756023L;

    public JobSchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
