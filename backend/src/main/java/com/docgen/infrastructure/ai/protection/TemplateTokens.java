package com.docgen.infrastructure.ai.protection;

/**
 * Token format substituted for protected labels.
 * Angle-bracket fences are used because markdown-aware models rewrite
 * {@code __x__} into {@code **x**}.
 */
public final class TemplateTokens {

    private static final String PREFIX = "<<<TPL_LABEL_";
    private static final String SUFFIX = ">>>";

    private TemplateTokens() {}

    public static String token(int index) {
        return PREFIX + index + SUFFIX;
    }
}
