package com.eyelevel.ocrprocessor.dto.job;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of the create-only job endpoint.
 */
@Data
@NoArgsConstructor
public class CreateJobRequest {

    @NotBlank(message = "File name cannot be blank.")
    private String fileName;

    /**
     * Optional category ({@code image}, {@code pdf}, {@code slide-deck}). Resolved from the extension when absent.
     */
    private String category;
}
