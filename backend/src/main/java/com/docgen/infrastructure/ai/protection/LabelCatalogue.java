package com.docgen.infrastructure.ai.protection;

import com.docgen.infrastructure.ai.OutputReliabilityException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered set of literal anchor lines that must survive an AI rewrite.
 * Immutable; the line patterns used by the protector and normalizer are compiled once here.
 */
public final class LabelCatalogue {

    // Optional decorations a model adds around a label it otherwise kept: **bold** or a ### heading
    private static final String DECORATION_PREFIX = "(?:\\*\\*|###[ \\t]+)?";
    private static final String DECORATION_SUFFIX = "(?:\\*\\*)?";

    private final List<String> labels;
    private final Pattern protectionPattern;
    private final List<NormalizationRule> normalizationRules;

    private LabelCatalogue(List<String> labels) {
        this.labels = List.copyOf(labels);
        this.protectionPattern = buildProtectionPattern(this.labels);
        this.normalizationRules = this.labels.stream()
                .map(LabelCatalogue::buildNormalizationRule)
                .toList();
    }

    /**
     * Build a catalogue from configured label lines.
     *
     * @throws OutputReliabilityException if the list is empty or a label is blank or spans lines
     */
    public static LabelCatalogue of(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new OutputReliabilityException("Label catalogue must contain at least one label");
        }
        List<String> accepted = new ArrayList<>();
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                throw new OutputReliabilityException("Label catalogue contains a blank label");
            }
            if (label.contains("\n") || label.contains("\r")) {
                throw new OutputReliabilityException("Label must be a single line: '" + label + "'");
            }
            String trimmed = label.strip();
            if (!accepted.contains(trimmed)) {
                accepted.add(trimmed);
            }
        }
        return new LabelCatalogue(accepted);
    }

    public static LabelCatalogue of(String... labels) {
        return of(List.of(labels));
    }

    public List<String> labels() {
        return labels;
    }

    /**
     * Whole-line pattern over every label. Group 1 is the leading indentation.
     */
    Pattern protectionPattern() {
        return protectionPattern;
    }

    List<NormalizationRule> normalizationRules() {
        return normalizationRules;
    }

    private static Pattern buildProtectionPattern(List<String> labels) {
        String alternation = labels.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("^([ \\t]*)(?:" + alternation + ")[ \\t]*$", Pattern.MULTILINE);
    }

    private static NormalizationRule buildNormalizationRule(String label) {
        // "**Prerequisites**:" → "Prerequisites**:"; the leading ** is covered by DECORATION_PREFIX
        String core = stripAsterisks(label);
        Pattern pattern = Pattern.compile(
                "^([ \\t]*)" + DECORATION_PREFIX + Pattern.quote(core) + DECORATION_SUFFIX + "[ \\t]*$",
                Pattern.MULTILINE | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new NormalizationRule(pattern, "$1" + Matcher.quoteReplacement(label));
    }

    private static String stripAsterisks(String label) {
        int start = 0;
        int end = label.length();
        while (start < end && label.charAt(start) == '*') {
            start++;
        }
        while (end > start && label.charAt(end - 1) == '*') {
            end--;
        }
        return label.substring(start, end);
    }

    /**
     * Tolerant pattern for one label and its canonical replacement.
     */
    record NormalizationRule(Pattern pattern, String replacement) {}
}
