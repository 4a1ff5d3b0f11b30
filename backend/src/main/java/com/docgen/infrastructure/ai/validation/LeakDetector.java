package com.docgen.infrastructure.ai.validation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Finds placeholder tokens that survived restoration.
 * Any hit means the round trip failed and the rewritten content must not be published.
 */
@Component
@RequiredArgsConstructor
public class LeakDetector {

    private final LeakPatternCatalogue leakPatterns;

    /**
     * @param content restored and normalized content
     * @return every leaked token in order of appearance, empty if clean
     */
    public List<String> detect(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        List<String> leaked = new ArrayList<>();
        Matcher matcher = leakPatterns.combined().matcher(content);
        while (matcher.find()) {
            leaked.add(matcher.group());
        }
        return leaked;
    }

    public boolean isClean(String content) {
        return detect(content).isEmpty();
    }
}
