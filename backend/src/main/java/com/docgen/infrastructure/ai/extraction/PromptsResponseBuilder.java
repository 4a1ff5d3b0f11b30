package com.docgen.infrastructure.ai.extraction;

import com.docgen.domain.prompt.model.ParsedPromptsResponse;
import com.docgen.infrastructure.ai.postprocessing.TextSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns {@code {"tool name": ["prompt", ...]}} into a {@link ParsedPromptsResponse}.
 * <p>
 * The model is asked about exactly one tool, so only the first key in document order is
 * used; any further keys are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptsResponseBuilder {

    private final LenientJsonParser jsonParser;
    private final TextSanitizer textSanitizer;

    /**
     * @param extractedJson JSON text from {@link LlmJsonExtractor}
     * @return the first tool's sanitized prompts, or empty if nothing usable was decoded
     */
    public Optional<ParsedPromptsResponse> build(String extractedJson) {
        Optional<ObjectNode> parsed = jsonParser.parseObject(extractedJson);
        if (parsed.isEmpty() || parsed.get().isEmpty()) {
            return Optional.empty();
        }

        ObjectNode root = parsed.get();
        Map.Entry<String, JsonNode> first = root.fields().next();
        JsonNode values = first.getValue();

        if (!values.isArray()) {
            log.warn("Prompts for '{}' are not an array: {}", first.getKey(), values.getNodeType());
            return Optional.empty();
        }

        List<String> prompts = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            if (!value.isTextual()) {
                log.warn("Prompt list for '{}' contains a non-string value: {}", first.getKey(), value.getNodeType());
                return Optional.empty();
            }
            prompts.add(textSanitizer.sanitize(value.textValue()));
        }

        if (root.size() > 1) {
            log.debug("Ignoring {} additional tool keys after '{}'", root.size() - 1, first.getKey());
        }

        return Optional.of(new ParsedPromptsResponse(first.getKey(), prompts));
    }
}
