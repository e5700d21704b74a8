package com.eyelevel.ocrprocessor.service.handlers;

import com.eyelevel.ocrprocessor.model.ImageReference;
import com.eyelevel.ocrprocessor.model.TableFragment;
import com.eyelevel.ocrprocessor.model.TextFragment;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * The tagged output of a {@link CategoryHandler}. Image paths and output file paths point into the
 * working directory the handler was given.
 */
@Value
@Builder
public class HandledContent {

    @Singular
    List<TextFragment> texts;

    @Singular
    List<TableFragment> tables;

    @Singular
    List<ImageReference> images;

    @Singular
    Map<String, String> outputFiles;
}
