package com.gs.ep.pdftranslator.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Serves boxes produced ahead of time by an external layout model.
 *
 * <p>Expected format, keyed by 0-based page index:</p>
 * <pre>
 * {
 *   "0": [ {"label": "figure", "x0": 50, "y0": 80, "x1": 560, "y1": 380, "confidence": 0.93} ],
 *   "2": [ ... ]
 * }
 * </pre>
 * Pages without an entry get no boxes.
 */
public class JsonLayoutDetector implements LayoutDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonLayoutDetector.class);

    private final Map<Integer, List<LayoutBox>> boxesByPage;

    public JsonLayoutDetector(Map<Integer, List<LayoutBox>> boxesByPage) {
        this.boxesByPage = new HashMap<>(boxesByPage);
    }

    public static JsonLayoutDetector fromFile(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            return fromStream(input);
        }
    }

    public static JsonLayoutDetector fromStream(InputStream input) throws IOException {
        JsonNode root = new ObjectMapper().readTree(input);
        if (root == null || !root.isObject()) {
            throw new IOException("Layout file must contain a JSON object keyed by page index");
        }
        Map<Integer, List<LayoutBox>> boxesByPage = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int pageIndex;
            try {
                pageIndex = Integer.parseInt(field.getKey().trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid page index in layout file: " + field.getKey(), e);
            }
            List<LayoutBox> boxes = new ArrayList<>();
            for (JsonNode node : field.getValue()) {
                boxes.add(readBox(node));
            }
            boxesByPage.put(pageIndex, boxes);
        }
        LOGGER.info("Loaded precomputed layout for {} pages", boxesByPage.size());
        return new JsonLayoutDetector(boxesByPage);
    }

    private static LayoutBox readBox(JsonNode node) throws IOException {
        try {
            return new LayoutBox(
                    LayoutCategory.fromLabel(node.path("label").asText()),
                    node.path("x0").asDouble(),
                    node.path("y0").asDouble(),
                    node.path("x1").asDouble(),
                    node.path("y1").asDouble(),
                    node.path("confidence").asDouble(1.0));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid layout box: " + node, e);
        }
    }

    @Override
    public List<LayoutBox> detect(PageImage page, int tileSize) {
        List<LayoutBox> boxes = boxesByPage.get(page.getPageIndex());
        return boxes == null ? Collections.emptyList() : Collections.unmodifiableList(boxes);
    }
}
