package com.docgen.infrastructure.ai.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Isolates the JSON object in a model response that may carry preamble text,
 * reasoning steps or verification checklists around it.
 * <p>
 * Strategies, first hit wins:
 * <ol>
 *   <li>the body of a {@code ```json} fenced block</li>
 *   <li>the body of the last generic {@code ```} fenced block, if it starts with {@code {}</li>
 *   <li>the first balanced {@code {...}} region found by brace counting</li>
 * </ol>
 * Brace counting does not look inside string literals.
 */
@Slf4j
@Component
public class LlmJsonExtractor {

    private static final String FENCE = "```";
    private static final String JSON_FENCE = "```json";

    /**
     * @param response raw model text (nullable)
     * @return the JSON substring, or "" if none was found
     */
    public String extract(String response) {
        if (response == null || response.isEmpty()) {
            return "";
        }

        String fromJsonFence = fromJsonFence(response);
        if (fromJsonFence != null) {
            log.debug("JSON extracted from ```json block");
            return fromJsonFence;
        }

        String fromLastFence = fromLastFence(response);
        if (fromLastFence != null) {
            log.debug("JSON extracted from last ``` block");
            return fromLastFence;
        }

        String fromBraces = fromBalancedBraces(response);
        if (fromBraces.isEmpty()) {
            log.debug("No JSON structure found in response");
        } else {
            log.debug("JSON extracted using brace matching");
        }
        return fromBraces;
    }

    private String fromJsonFence(String text) {
        int opener = text.indexOf(JSON_FENCE);
        if (opener < 0) {
            return null;
        }
        int start = opener + JSON_FENCE.length();
        int end = text.indexOf(FENCE, start);
        if (end <= start) {
            return null;
        }
        return text.substring(start, end).trim();
    }

    private String fromLastFence(String text) {
        int closing = text.lastIndexOf(FENCE);
        if (closing < FENCE.length()) {
            return null;
        }
        // Only fences that end before the closing one starts
        int opening = text.lastIndexOf(FENCE, closing - FENCE.length());
        if (opening < 0) {
            return null;
        }
        String body = text.substring(opening + FENCE.length(), closing).trim();
        return body.startsWith("{") ? body : null;
    }

    private String fromBalancedBraces(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return "";
        }
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return "";
    }
}
