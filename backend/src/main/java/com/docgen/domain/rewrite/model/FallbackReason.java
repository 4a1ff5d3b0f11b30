package com.docgen.domain.rewrite.model;

public enum FallbackReason {
    NONE,
    TRUNCATED,
    EMPTY_RESPONSE,
    LEAKED_TOKENS,
    /** The original already contained token-shaped text, so restoring could not be trusted. */
    PREEXISTING_TOKENS
}
