package com.eyelevel.ocrprocessor.dto.job;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A DTO representing the response from the retention sweep endpoint.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CleanupResponse {

    /**
     * A human-readable summary, e.g. "Cleaned up 3 expired jobs".
     */
    private String message;

    private int jobsRemoved;
}
