package com.eyelevel.ocrprocessor.service.handlers;

import com.eyelevel.ocrprocessor.exception.ExtractionException;
import com.eyelevel.ocrprocessor.model.FileCategory;

import java.io.IOException;

/**
 * Defines the contract for the category-specific part of a job within the dispatch pipeline.
 * Each implementation handles exactly one {@link FileCategory}.
 */
public interface CategoryHandler {

    /**
     * @return The category this handler processes.
     */
    FileCategory category();

    /**
     * Runs the extraction capability of this category over the job's file, writes the derived artifacts into
     * the working directory, reports intermediate progress and tags the extracted fragments.
     *
     * @param context The job's file, working directory and progress channel.
     * @return The tagged content and the artifacts written.
     * @throws IOException         if an artifact cannot be written.
     * @throws ExtractionException if the capability produced no usable output.
     */
    HandledContent handle(HandlerContext context) throws IOException, ExtractionException;
}
