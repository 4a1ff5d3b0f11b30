package com.docgen.infrastructure.ai.protection;

import com.docgen.domain.rewrite.model.ProtectedContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Replaces template label lines with positional tokens before content is sent to the model,
 * so the model cannot reword or drop them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateLabelProtector {

    private final LabelCatalogue labelCatalogue;

    /**
     * Swap every catalogue label line for {@code <<<TPL_LABEL_n>>>}, numbering from 0 in order
     * of appearance. Leading indentation stays in the content; the token maps to the rest of the
     * matched line, so restoring reproduces the input exactly.
     *
     * @param content markdown content (nullable)
     * @return protected content and a fresh token map
     */
    public ProtectedContent protect(String content) {
        if (content == null || content.isEmpty()) {
            return ProtectedContent.unchanged(content);
        }

        Map<String, String> tokenMap = new LinkedHashMap<>();
        Matcher matcher = labelCatalogue.protectionPattern().matcher(content);
        StringBuilder sb = new StringBuilder();
        int index = 0;

        while (matcher.find()) {
            String indent = matcher.group(1);
            String token = TemplateTokens.token(index++);
            tokenMap.put(token, matcher.group().substring(indent.length()));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(indent + token));
        }
        matcher.appendTail(sb);

        if (tokenMap.isEmpty()) {
            return ProtectedContent.unchanged(content);
        }

        log.debug("Protected {} template labels", tokenMap.size());
        return new ProtectedContent(sb.toString(), tokenMap);
    }
}
