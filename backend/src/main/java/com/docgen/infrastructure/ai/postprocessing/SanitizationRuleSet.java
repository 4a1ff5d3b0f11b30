package com.docgen.infrastructure.ai.postprocessing;

import com.docgen.infrastructure.ai.OutputReliabilityException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered replacement rules applied in a single left-to-right scan.
 * Replaced text is never rescanned, so {@code &amp;lt;} becomes {@code &lt;}, not {@code <}.
 * Where two targets start at the same position, the earlier rule wins.
 */
public final class SanitizationRuleSet {

    private static final List<SanitizationRule> DEFAULT_RULES = List.of(
            // Smart quotes
            new SanitizationRule("\u2018", "'"),
            new SanitizationRule("\u2019", "'"),
            new SanitizationRule("\u201C", "\""),
            new SanitizationRule("\u201D", "\""),
            // HTML entities
            new SanitizationRule("&quot;", "\""),
            new SanitizationRule("&#34;", "\""),
            new SanitizationRule("&apos;", "'"),
            new SanitizationRule("&#39;", "'"),
            new SanitizationRule("&amp;", "&"),
            new SanitizationRule("&lt;", "<"),
            new SanitizationRule("&gt;", ">")
    );

    private final Pattern combined;
    private final Map<String, String> replacements;

    private SanitizationRuleSet(List<SanitizationRule> rules) {
        this.combined = Pattern.compile(rules.stream()
                .map(rule -> Pattern.quote(rule.target()))
                .collect(Collectors.joining("|")));
        this.replacements = new HashMap<>();
        for (SanitizationRule rule : rules) {
            replacements.putIfAbsent(rule.target(), rule.replacement());
        }
    }

    public static SanitizationRuleSet of(List<SanitizationRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new OutputReliabilityException("Sanitization rule set must contain at least one rule");
        }
        for (SanitizationRule rule : rules) {
            if (rule.target() == null || rule.target().isEmpty() || rule.replacement() == null) {
                throw new OutputReliabilityException("Invalid sanitization rule: " + rule);
            }
        }
        return new SanitizationRuleSet(rules);
    }

    /**
     * Smart quotes to straight quotes, and the HTML entities models emit for quotes,
     * ampersands and angle brackets.
     */
    public static SanitizationRuleSet defaults() {
        return new SanitizationRuleSet(DEFAULT_RULES);
    }

    String apply(String text) {
        Matcher matcher = combined.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        do {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacements.get(matcher.group())));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }
}
