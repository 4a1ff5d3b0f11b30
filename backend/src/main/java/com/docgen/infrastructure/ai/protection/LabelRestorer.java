package com.docgen.infrastructure.ai.protection;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Puts the original label lines back in place of their tokens.
 */
@Component
public class LabelRestorer {

    /**
     * Literal replace-all of every token with its original line.
     * Tokens the model altered are left as they are and surface in leak detection.
     *
     * @param content  model output
     * @param tokenMap map produced by {@link TemplateLabelProtector} for the same document
     * @return restored content
     */
    public String restore(String content, Map<String, String> tokenMap) {
        if (content == null || content.isEmpty() || tokenMap == null || tokenMap.isEmpty()) {
            return content;
        }

        String restored = content;
        for (Map.Entry<String, String> entry : tokenMap.entrySet()) {
            restored = restored.replace(entry.getKey(), entry.getValue());
        }
        return restored;
    }
}
