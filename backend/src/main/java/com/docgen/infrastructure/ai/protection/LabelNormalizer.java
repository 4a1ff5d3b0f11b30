package com.docgen.infrastructure.ai.protection;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Collapses decorated renderings of catalogue labels back to their canonical text.
 * Handles {@code **label**} and {@code ### label} only; other markup is left untouched.
 */
@Component
@RequiredArgsConstructor
public class LabelNormalizer {

    private final LabelCatalogue labelCatalogue;

    public String normalize(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }

        String normalized = content;
        for (LabelCatalogue.NormalizationRule rule : labelCatalogue.normalizationRules()) {
            normalized = rule.pattern().matcher(normalized).replaceAll(rule.replacement());
        }
        return normalized;
    }
}
