package com.docgen.domain.rewrite.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Markdown with its template labels swapped for opaque tokens.
 * Created once per document before the model call and consumed once by the restorer.
 *
 * @param content  the markdown sent to the model
 * @param tokenMap token → original label line, in order of first appearance
 */
public record ProtectedContent(
        String content,
        Map<String, String> tokenMap
) {
    public ProtectedContent {
        tokenMap = tokenMap == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tokenMap));
    }

    /**
     * Content with nothing protected (no label matched, or empty input).
     */
    public static ProtectedContent unchanged(String content) {
        return new ProtectedContent(content, Map.of());
    }

    public int tokenCount() {
        return tokenMap.size();
    }
}
