package com.docgen.domain.prompt.model;

import java.util.Optional;

/**
 * Result of running a raw model response through the example prompt pipeline.
 *
 * @param status        what the pipeline managed to get out of the response
 * @param extractedJson the JSON substring found in the response ("" if none)
 * @param response      the parsed prompts (null unless EXTRACTED or NO_PROMPTS)
 */
public record PromptExtractionResult(
        ExtractionStatus status,
        String extractedJson,
        ParsedPromptsResponse response
) {
    public static PromptExtractionResult noJson() {
        return new PromptExtractionResult(ExtractionStatus.NO_JSON, "", null);
    }

    public static PromptExtractionResult unparseable(String extractedJson) {
        return new PromptExtractionResult(ExtractionStatus.UNPARSEABLE, extractedJson, null);
    }

    public static PromptExtractionResult of(String extractedJson, ParsedPromptsResponse response) {
        ExtractionStatus status = response.hasPrompts() ? ExtractionStatus.EXTRACTED : ExtractionStatus.NO_PROMPTS;
        return new PromptExtractionResult(status, extractedJson, response);
    }

    /**
     * True when the host can publish the prompts.
     */
    public boolean isUsable() {
        return status == ExtractionStatus.EXTRACTED;
    }

    public Optional<ParsedPromptsResponse> parsed() {
        return Optional.ofNullable(response);
    }
}
