package com.docgen.infrastructure.ai.pipeline;

import com.docgen.domain.rewrite.model.FallbackReason;
import com.docgen.domain.rewrite.model.ModelResponse;
import com.docgen.domain.rewrite.model.ProtectedContent;
import com.docgen.domain.rewrite.model.RewriteOutcome;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context for one document's trip through the rewrite pipeline.
 * Never shared between documents.
 */
@Data
public class RewritePipelineContext {

    // --- Input ---
    private String originalContent;
    private List<String> preexistingTokens = new ArrayList<>();

    // --- Protection ---
    private ProtectedContent protectedContent;

    // --- Model output ---
    private ModelResponse modelResponse;

    // --- Restore / normalize ---
    private String restoredContent;
    private String normalizedContent;

    // --- Validation ---
    private List<String> leakedTokens = new ArrayList<>();
    private FallbackReason fallbackReason = FallbackReason.NONE;

    public boolean hasPreexistingTokens() {
        return !preexistingTokens.isEmpty();
    }

    /**
     * Clear everything a previous response left behind.
     */
    public void resetResponseState() {
        modelResponse = null;
        restoredContent = null;
        normalizedContent = null;
        leakedTokens = new ArrayList<>();
        fallbackReason = FallbackReason.NONE;
    }

    /**
     * Content to hand to the model.
     */
    public String getModelInput() {
        return protectedContent != null ? protectedContent.content() : originalContent;
    }

    /**
     * Build the final RewriteOutcome from accumulated context.
     */
    public RewriteOutcome toRewriteOutcome() {
        String content = fallbackReason == FallbackReason.NONE
                ? normalizedContent
                : originalContent;
        return new RewriteOutcome(content, fallbackReason, leakedTokens);
    }
}
