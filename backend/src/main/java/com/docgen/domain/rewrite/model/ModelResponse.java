package com.docgen.domain.rewrite.model;

/**
 * Text returned by the external model call.
 *
 * @param content   the raw completion text (nullable)
 * @param truncated true if the provider reported the completion was cut off
 */
public record ModelResponse(String content, boolean truncated) {

    public static ModelResponse complete(String content) {
        return new ModelResponse(content, false);
    }

    public static ModelResponse truncated(String content) {
        return new ModelResponse(content, true);
    }
}
