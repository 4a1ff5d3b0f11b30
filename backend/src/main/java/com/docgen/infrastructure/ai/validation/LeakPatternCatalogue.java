package com.docgen.infrastructure.ai.validation;

import com.docgen.infrastructure.ai.OutputReliabilityException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Token formats that count as a leak when found in restored content:
 * the current format plus every format earlier releases emitted.
 */
public final class LeakPatternCatalogue {

    private final List<Pattern> patterns;
    private final Pattern combined;

    private LeakPatternCatalogue(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
        this.combined = Pattern.compile(this.patterns.stream()
                .map(p -> "(?:" + p.pattern() + ")")
                .collect(Collectors.joining("|")));
    }

    /**
     * @param regexes regular expressions, one per token format
     * @throws OutputReliabilityException if the list is empty or a pattern does not compile
     */
    public static LeakPatternCatalogue of(List<String> regexes) {
        if (regexes == null || regexes.isEmpty()) {
            throw new OutputReliabilityException("At least one leaked-token pattern is required");
        }
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : regexes) {
            if (regex == null || regex.isBlank()) {
                throw new OutputReliabilityException("Leaked-token pattern must not be blank");
            }
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new OutputReliabilityException("Invalid leaked-token pattern: " + regex, e);
            }
        }
        return new LeakPatternCatalogue(compiled);
    }

    public static LeakPatternCatalogue of(String... regexes) {
        return of(List.of(regexes));
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    Pattern combined() {
        return combined;
    }
}
