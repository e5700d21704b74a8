package com.eyelevel.ocrprocessor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageReference {
    private String path;
    private FragmentSource source;
    private Integer pageNumber;
}
