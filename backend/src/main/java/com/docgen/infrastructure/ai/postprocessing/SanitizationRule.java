package com.docgen.infrastructure.ai.postprocessing;

/**
 * Literal text and what it becomes.
 */
public record SanitizationRule(String target, String replacement) {}
