package com.eyelevel.ocrprocessor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextFragment {
    private String text;
    private FragmentSource source;
    /**
     * Page or slide number, when it could be determined.
     */
    private Integer pageNumber;
}
