package com.eyelevel.ocrprocessor.service.extraction.impl;

import com.eyelevel.ocrprocessor.exception.ExtractionException;
import com.eyelevel.ocrprocessor.service.extraction.ExtractionOutput;
import com.eyelevel.ocrprocessor.service.extraction.ocr.OcrEngine;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SlideDeckExtractionCapabilityTest {

    @TempDir
    Path tempDir;

    private OcrEngine ocrEngine;
    private SlideDeckExtractionCapability capability;
    private Path imagesDir;

    @BeforeEach
    void setUp() throws IOException {
        ocrEngine = mock(OcrEngine.class);
        capability = new SlideDeckExtractionCapability(ocrEngine);
        imagesDir = Files.createDirectories(tempDir.resolve("deck"));
    }

    @Test
    void extract_collectsTextTablesAndPicturesInShapeOrder() throws Exception {
        // Given
        Path deck = writeDeck();
        when(ocrEngine.recognize(eq(imagesDir.resolve("slide1_img3.png")), anyString())).thenReturn("chart label");

        // When
        ExtractionOutput output = capability.extract(deck, imagesDir);

        // Then
        assertThat(output.texts()).containsExactly("Quarterly results", "chart label");
        assertThat(output.tablesHtml()).containsExactly(
                "<table><tr><td>A &amp; B</td><td>Total</td></tr><tr><td>1</td><td>2</td></tr></table>");
        assertThat(imagesDir.resolve("slide1_img3.png")).isRegularFile();
    }

    @Test
    void extract_keepsPictureWhenItsOcrFails() throws Exception {
        // Given
        Path deck = writeDeck();
        when(ocrEngine.recognize(eq(imagesDir.resolve("slide1_img3.png")), anyString()))
                .thenThrow(new ExtractionException("tesseract crashed"));

        // When
        ExtractionOutput output = capability.extract(deck, imagesDir);

        // Then
        assertThat(output.texts()).containsExactly("Quarterly results");
        assertThat(imagesDir.resolve("slide1_img3.png")).isRegularFile();
    }

    @Test
    void extract_unreadableFileIsAnExtractionError() throws Exception {
        // Given
        Path notDeck = Files.writeString(tempDir.resolve("broken.pptx"), "this is not a deck");

        // When / Then
        assertThatThrownBy(() -> capability.extract(notDeck, imagesDir))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("broken.pptx");
    }

    private Path writeDeck() throws IOException {
        Path target = tempDir.resolve("deck.pptx");
        try (XMLSlideShow slideShow = new XMLSlideShow()) {
            XSLFSlide slide = slideShow.createSlide();

            XSLFTextBox textBox = slide.createTextBox();
            textBox.setAnchor(new Rectangle2D.Double(20, 20, 400, 50));
            textBox.setText("Quarterly results");

            XSLFTable table = slide.createTable(2, 2);
            table.setAnchor(new Rectangle2D.Double(20, 100, 400, 100));
            table.getCell(0, 0).setText("A & B");
            table.getCell(0, 1).setText("Total");
            table.getCell(1, 0).setText("1");
            table.getCell(1, 1).setText("2");

            XSLFPictureData picture = slideShow.addPicture(pngBytes(), PictureData.PictureType.PNG);
            slide.createPicture(picture).setAnchor(new Rectangle2D.Double(20, 250, 50, 50));

            try (OutputStream out = Files.newOutputStream(target)) {
                slideShow.write(out);
            }
        }
        return target;
    }

    private static byte[] pngBytes() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "png", out);
        return out.toByteArray();
    }
}
