package com.docgen.domain.rewrite.model;

import java.util.List;

/**
 * Final output of the content rewrite pipeline.
 *
 * @param content        the content to publish (rewritten, or the pre-rewrite original on fallback)
 * @param fallbackReason why the original was published instead, {@link FallbackReason#NONE} otherwise
 * @param leakedTokens   leaked tokens, or token-shaped text already in the original (empty unless LEAKED_TOKENS or PREEXISTING_TOKENS)
 */
public record RewriteOutcome(
        String content,
        FallbackReason fallbackReason,
        List<String> leakedTokens
) {
    public RewriteOutcome {
        leakedTokens = leakedTokens == null ? List.of() : List.copyOf(leakedTokens);
    }

    public boolean fellBack() {
        return fallbackReason != FallbackReason.NONE;
    }
}
