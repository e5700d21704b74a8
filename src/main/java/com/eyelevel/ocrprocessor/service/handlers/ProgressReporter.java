package com.eyelevel.ocrprocessor.service.handlers;

/**
 * Receives intermediate progress checkpoints from a {@link CategoryHandler}.
 */
@FunctionalInterface
public interface ProgressReporter {

    void report(int progress, String message);
}
