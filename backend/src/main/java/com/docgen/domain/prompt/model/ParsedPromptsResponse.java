package com.docgen.domain.prompt.model;

import java.util.List;

/**
 * Example prompts the model produced for one tool.
 *
 * @param toolName the first key of the model's JSON object
 * @param prompts  sanitized prompt strings, possibly empty
 */
public record ParsedPromptsResponse(
        String toolName,
        List<String> prompts
) {
    public ParsedPromptsResponse {
        prompts = prompts == null ? List.of() : List.copyOf(prompts);
    }

    public boolean hasPrompts() {
        return !prompts.isEmpty();
    }
}
