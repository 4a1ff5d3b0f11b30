package com.docgen.infrastructure.ai.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parses JSON objects the way models tend to write them: trailing commas before
 * {@code ]} or {@code }} are accepted. Failures are reported as empty, never thrown.
 */
@Slf4j
@Component
public class LenientJsonParser {

    private final ObjectReader reader;

    public LenientJsonParser(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(JsonReadFeature.ALLOW_TRAILING_COMMA);
    }

    /**
     * @param json extracted JSON text (nullable)
     * @return the decoded object, or empty if the text is blank, malformed, or not an object
     */
    public Optional<ObjectNode> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }

        try {
            JsonNode node = reader.readTree(json);
            if (node instanceof ObjectNode objectNode) {
                return Optional.of(objectNode);
            }
            log.warn("Model JSON is not an object: {}", node == null ? "empty" : node.getNodeType());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("JSON parse failed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
