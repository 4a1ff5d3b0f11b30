package com.docgen.infrastructure.ai.pipeline;

import com.docgen.domain.prompt.model.ParsedPromptsResponse;
import com.docgen.domain.prompt.model.PromptExtractionResult;
import com.docgen.infrastructure.ai.extraction.LlmJsonExtractor;
import com.docgen.infrastructure.ai.extraction.PromptsResponseBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a raw example-prompt response into structured prompts:
 * <p>
 * extract JSON → lenient parse → first tool key → sanitize prompts
 * </p>
 * Whether to skip, log or retry a tool with no usable prompts is the caller's decision.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExamplePromptPipeline {

    private final LlmJsonExtractor jsonExtractor;
    private final PromptsResponseBuilder responseBuilder;

    public PromptExtractionResult extract(String rawResponse) {
        String json = jsonExtractor.extract(rawResponse);
        if (json.isEmpty()) {
            log.warn("No JSON found in model response");
            return PromptExtractionResult.noJson();
        }

        Optional<ParsedPromptsResponse> parsed = responseBuilder.build(json);
        if (parsed.isEmpty()) {
            log.warn("Model JSON could not be read as tool prompts");
            return PromptExtractionResult.unparseable(json);
        }

        PromptExtractionResult result = PromptExtractionResult.of(json, parsed.get());
        if (result.isUsable()) {
            log.info("Extracted {} prompts for '{}'", parsed.get().prompts().size(), parsed.get().toolName());
        } else {
            log.warn("Model returned no prompts for '{}'", parsed.get().toolName());
        }
        return result;
    }

    /**
     * Text to keep as the raw-output record of a call: the JSON if one was found,
     * otherwise the response as-is.
     */
    public String auditJson(String rawResponse) {
        if (rawResponse == null) {
            return "";
        }
        String json = jsonExtractor.extract(rawResponse);
        return json.isEmpty() ? rawResponse : json;
    }
}
