package com.harvey.backend.service.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the flat JSON metrics file a training job leaves next to its artifact.
 * Non-numeric fields are ignored.
 */
@Component
@RequiredArgsConstructor
public class ModelMetricsReader {

    private final ObjectMapper objectMapper;

    public Map<String, Double> read(Path metricsFile) throws IOException {
        JsonNode root = objectMapper.readTree(metricsFile.toFile());
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (root == null || !root.isObject()) {
            return metrics;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                metrics.put(field.getKey(), field.getValue().asDouble());
            }
        }
        return metrics;
    }
}
