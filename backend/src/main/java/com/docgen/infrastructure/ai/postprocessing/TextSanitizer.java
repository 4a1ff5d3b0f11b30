package com.docgen.infrastructure.ai.postprocessing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Cleans AI-generated prompt text: smart quotes → straight quotes, HTML entities → plain text.
 */
@Component
@RequiredArgsConstructor
public class TextSanitizer {

    private final SanitizationRuleSet ruleSet;

    /**
     * @param text prompt text (nullable)
     * @return sanitized text; the same instance when nothing matched
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return ruleSet.apply(text);
    }
}
