package com.docgen.infrastructure.ai.pipeline;

import com.docgen.domain.rewrite.model.FallbackReason;
import com.docgen.domain.rewrite.model.ModelResponse;
import com.docgen.domain.rewrite.model.ProtectedContent;
import com.docgen.domain.rewrite.model.RewriteOutcome;
import com.docgen.infrastructure.ai.protection.LabelNormalizer;
import com.docgen.infrastructure.ai.protection.LabelRestorer;
import com.docgen.infrastructure.ai.protection.TemplateLabelProtector;
import com.docgen.infrastructure.ai.validation.LeakDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Makes an AI rewrite of templated markdown safe to publish:
 * <p>
 * protect → [model] → restore → normalize → leak check → rewritten content or original
 * </p>
 * A truncated or empty model response, or any leaked token, publishes the pre-rewrite original.
 * So does an original that already contains token-shaped text, without calling the model.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentRewritePipeline {

    private final TemplateLabelProtector labelProtector;
    private final LabelRestorer labelRestorer;
    private final LabelNormalizer labelNormalizer;
    private final LeakDetector leakDetector;

    /**
     * Protect the template labels of one document.
     * Send {@link RewritePipelineContext#getModelInput()} to the model, then call
     * {@link #complete(RewritePipelineContext, ModelResponse)}.
     */
    public RewritePipelineContext prepare(String originalContent) {
        RewritePipelineContext ctx = new RewritePipelineContext();
        ctx.setOriginalContent(originalContent);

        List<String> preexisting = leakDetector.detect(originalContent);
        if (!preexisting.isEmpty()) {
            log.warn("Original content already contains token-shaped text {}, rewrite will be skipped", preexisting);
            ctx.setPreexistingTokens(preexisting);
        }

        ProtectedContent protectedContent = labelProtector.protect(originalContent);
        ctx.setProtectedContent(protectedContent);

        if (protectedContent.tokenCount() > 0) {
            log.debug("Protected {} labels: {}", protectedContent.tokenCount(),
                    protectedContent.tokenMap().keySet());
        }
        return ctx;
    }

    /**
     * Post-process the model's response for a prepared document.
     * May be called again on the same context with a retried response.
     */
    public RewriteOutcome complete(RewritePipelineContext ctx, ModelResponse response) {
        ctx.resetResponseState();
        ctx.setModelResponse(response);

        if (ctx.hasPreexistingTokens()) {
            ctx.setLeakedTokens(new ArrayList<>(ctx.getPreexistingTokens()));
            ctx.setFallbackReason(FallbackReason.PREEXISTING_TOKENS);
            return ctx.toRewriteOutcome();
        }

        if (response != null && response.truncated()) {
            log.warn("Model response truncated, falling back to original content");
            ctx.setFallbackReason(FallbackReason.TRUNCATED);
            return ctx.toRewriteOutcome();
        }

        if (response == null || response.content() == null || response.content().isBlank()) {
            log.warn("Model response is empty, falling back to original content");
            ctx.setFallbackReason(FallbackReason.EMPTY_RESPONSE);
            return ctx.toRewriteOutcome();
        }

        // Restore
        String restored = labelRestorer.restore(response.content(), ctx.getProtectedContent().tokenMap());
        ctx.setRestoredContent(restored);

        // Normalize
        String normalized = labelNormalizer.normalize(restored);
        ctx.setNormalizedContent(normalized);

        // Validate
        List<String> leaked = leakDetector.detect(normalized);
        ctx.setLeakedTokens(leaked);

        if (!leaked.isEmpty()) {
            log.warn("Leaked tokens detected: {}. Falling back to original content", leaked);
            ctx.setFallbackReason(FallbackReason.LEAKED_TOKENS);
        }

        return ctx.toRewriteOutcome();
    }

    /**
     * Run the whole round trip with the caller's model invocation.
     *
     * @param originalContent templated markdown
     * @param modelCall       sends protected content to the model and returns its response
     */
    public RewriteOutcome rewrite(String originalContent, Function<String, ModelResponse> modelCall) {
        RewritePipelineContext ctx = prepare(originalContent);
        if (ctx.hasPreexistingTokens()) {
            return complete(ctx, null);
        }
        return complete(ctx, modelCall.apply(ctx.getModelInput()));
    }
}
