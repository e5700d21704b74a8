package com.eyelevel.ocrprocessor.service.handlers.impl;

import com.eyelevel.ocrprocessor.model.FragmentSource;
import com.eyelevel.ocrprocessor.model.ImageReference;
import com.eyelevel.ocrprocessor.model.TableFragment;
import com.eyelevel.ocrprocessor.model.TextFragment;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionCapability;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionOutput;
import com.eyelevel.ocrprocessor.service.handlers.HandledContent;
import com.eyelevel.ocrprocessor.service.handlers.HandlerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PdfCategoryHandlerTest {

    @TempDir
    Path workingDir;

    private final List<String> reported = new ArrayList<>();

    private ExtractionCapability capability;
    private PdfCategoryHandler handler;

    @BeforeEach
    void setUp() {
        capability = mock(ExtractionCapability.class);
        handler = new PdfCategoryHandler(capability);
    }

    @Test
    void handle_tagsFragmentsAndWritesArtifacts() throws Exception {
        // Given
        when(capability.extract(any(), any())).thenAnswer(invocation -> {
            Path imagesDir = invocation.getArgument(1);
            Files.write(imagesDir.resolve("page_2.png"), new byte[]{1});
            Files.write(imagesDir.resolve("page_1.png"), new byte[]{1});
            Files.write(imagesDir.resolve("thumbnail.jpg"), new byte[]{1});
            return new ExtractionOutput(List.of("Native text ", "Page 2 (OCR): scanned"), List.of("<table></table>"));
        });

        // When
        HandledContent content = handler.handle(context("report.pdf"));

        // Then
        Path imagesDir = workingDir.resolve("report");
        assertThat(content.getTexts()).containsExactly(
                new TextFragment("Native text ", FragmentSource.TEXT, null),
                new TextFragment("scanned", FragmentSource.OCR, 2));
        assertThat(content.getTables()).containsExactly(new TableFragment("<table></table>", FragmentSource.PDF, null));
        assertThat(content.getImages()).containsExactly(
                new ImageReference(imagesDir.resolve("page_1.png").toString(), FragmentSource.PAGE, 1),
                new ImageReference(imagesDir.resolve("page_2.png").toString(), FragmentSource.PAGE, 2));
        assertThat(content.getOutputFiles())
                .containsEntry("text", workingDir.resolve("report.txt").toString())
                .containsEntry("tables", workingDir.resolve("report_tables.html").toString())
                .containsEntry("images_dir", imagesDir.toString());
        assertThat(workingDir.resolve("report.txt")).hasContent("Native text\n\nPage 2 (OCR): scanned\n\n");
        assertThat(reported).containsExactly(
                "30 Extracting text and tables from PDF",
                "70 Processing PDF pages",
                "90 PDF processing completed, preparing results");
    }

    @Test
    void handle_emptyDocumentStillProducesArtifacts() throws Exception {
        // Given
        when(capability.extract(any(), any())).thenReturn(new ExtractionOutput(List.of(), List.of()));

        // When
        HandledContent content = handler.handle(context("empty.pdf"));

        // Then
        assertThat(content.getTexts()).isEmpty();
        assertThat(content.getImages()).isEmpty();
        assertThat(workingDir.resolve("empty.txt")).isEmptyFile();
        assertThat(workingDir.resolve("empty_tables.html")).isEmptyFile();
    }

    private HandlerContext context(String fileName) {
        return HandlerContext.builder()
                .jobId("job-1")
                .fileName(fileName)
                .filePath(workingDir.resolve(fileName))
                .workingDir(workingDir)
                .progressReporter((progress, message) -> reported.add(progress + " " + message))
                .build();
    }
}
