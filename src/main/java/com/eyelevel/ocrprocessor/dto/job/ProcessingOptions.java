package com.eyelevel.ocrprocessor.dto.job;

import com.eyelevel.ocrprocessor.model.OutputFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options accepted as a JSON string in the {@code options} part of an upload, for example
 * {@code {"output_format":"files"}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessingOptions {

    @JsonProperty("output_format")
    private OutputFormat outputFormat = OutputFormat.JSON;

    /**
     * Accepted for compatibility; has no effect on processing.
     */
    private boolean verbose;

    public static ProcessingOptions defaults() {
        return new ProcessingOptions();
    }

    public OutputFormat getOutputFormat() {
        return outputFormat == null ? OutputFormat.JSON : outputFormat;
    }
}
