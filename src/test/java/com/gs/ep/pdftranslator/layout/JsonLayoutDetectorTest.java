package com.gs.ep.pdftranslator.layout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonLayoutDetectorTest {

    private static final String LAYOUT = "{\"0\": [{\"label\": \"figure\", \"x0\": 50, \"y0\": 80,"
            + " \"x1\": 560, \"y1\": 380, \"confidence\": 0.93},"
            + " {\"label\": \"text\", \"x0\": 50, \"y0\": 400, \"x1\": 560, \"y1\": 700}]}";

    private static PageImage page(int index) {
        return new PageImage(index, new BufferedImage(612, 792, BufferedImage.TYPE_INT_RGB));
    }

    @Test
    void detect_withEntryForPage_shouldReturnBoxesInFileOrder() throws IOException {
        JsonLayoutDetector detector = JsonLayoutDetector.fromStream(
                new ByteArrayInputStream(LAYOUT.getBytes(StandardCharsets.UTF_8)));

        List<LayoutBox> boxes = detector.detect(page(0), 768);

        assertEquals(2, boxes.size());
        assertEquals(LayoutCategory.FIGURE, boxes.get(0).category);
        assertEquals(0.93, boxes.get(0).confidence, 1e-9);
        assertEquals(LayoutCategory.TEXT, boxes.get(1).category);
        assertEquals(1.0, boxes.get(1).confidence, 1e-9);
        assertEquals(300.0, boxes.get(1).getHeight(), 1e-9);
        assertThrows(UnsupportedOperationException.class, () -> boxes.remove(0));
    }

    @Test
    void detect_withoutEntryForPage_shouldReturnEmptyList() throws IOException {
        JsonLayoutDetector detector = JsonLayoutDetector.fromStream(
                new ByteArrayInputStream(LAYOUT.getBytes(StandardCharsets.UTF_8)));

        assertTrue(detector.detect(page(3), 768).isEmpty());
    }

    @Test
    void fromFile_shouldReadLayoutFromDisk(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("layout.json");
        Files.write(file, LAYOUT.getBytes(StandardCharsets.UTF_8));

        assertEquals(2, JsonLayoutDetector.fromFile(file).detect(page(0), 768).size());
    }

    @Test
    void fromStream_withInvalidContent_shouldThrowIOException() {
        assertThrows(IOException.class, () -> JsonLayoutDetector.fromStream(
                new ByteArrayInputStream("[1, 2]".getBytes(StandardCharsets.UTF_8))));
        assertThrows(IOException.class, () -> JsonLayoutDetector.fromStream(
                new ByteArrayInputStream("{\"one\": []}".getBytes(StandardCharsets.UTF_8))));
        assertThrows(IOException.class, () -> JsonLayoutDetector.fromStream(
                new ByteArrayInputStream("{\"0\": [{\"label\": \"sidebar\"}]}".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void getTileSize_shouldRoundHeightDownToMultipleOf32() {
        assertEquals(768, page(0).getTileSize());
        assertEquals(32, new PageImage(0, new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB)).getTileSize());
    }
}
