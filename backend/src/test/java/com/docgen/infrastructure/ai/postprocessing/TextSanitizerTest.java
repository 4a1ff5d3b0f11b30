package com.docgen.infrastructure.ai.postprocessing;

import com.docgen.infrastructure.ai.OutputReliabilityException;
import com.docgen.infrastructure.ai.ReliabilityFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextSanitizerTest {

    private TextSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = ReliabilityFixtures.textSanitizer();
    }

    @Test
    @DisplayName("null and empty input")
    void sanitize_nullAndEmpty() {
        assertThat(sanitizer.sanitize(null)).isNull();
        assertThat(sanitizer.sanitize("")).isEmpty();
    }

    @Test
    @DisplayName("text without special characters returned as is")
    void sanitize_identity() {
        String input = "List all storage accounts in subscription <subscription-id>";

        assertThat(sanitizer.sanitize(input)).isSameAs(input);
    }

    @Test
    @DisplayName("smart quotes become straight quotes")
    void sanitize_smartQuotes() {
        assertThat(sanitizer.sanitize("it’s “ok” &amp; done")).isEqualTo("it's \"ok\" & done");
        assertThat(sanitizer.sanitize("‘single’")).isEqualTo("'single'");
    }

    @Test
    @DisplayName("HTML entities decoded")
    void sanitize_entities() {
        String input = "List &quot;secrets&quot; in vault &apos;x&apos; &amp; show &lt;y&gt;";

        assertThat(sanitizer.sanitize(input)).isEqualTo("List \"secrets\" in vault 'x' & show <y>");
    }

    @Test
    @DisplayName("numeric entities decoded")
    void sanitize_numericEntities() {
        assertThat(sanitizer.sanitize("&#34;a&#34; &#39;b&#39;")).isEqualTo("\"a\" 'b'");
    }

    @Test
    @DisplayName("decoded text is not decoded again")
    void sanitize_noDoubleDecoding() {
        assertThat(sanitizer.sanitize("&amp;lt;tag&amp;gt;")).isEqualTo("&lt;tag&gt;");
        assertThat(sanitizer.sanitize("&amp;quot;")).isEqualTo("&quot;");
    }

    @Test
    @DisplayName("unknown entities left alone")
    void sanitize_unknownEntity() {
        assertThat(sanitizer.sanitize("a&nbsp;b &copy;")).isEqualTo("a&nbsp;b &copy;");
    }

    @Test
    @DisplayName("custom rule set applied in a single pass")
    void sanitize_customRules() {
        TextSanitizer custom = new TextSanitizer(SanitizationRuleSet.of(List.of(
                new SanitizationRule("a", "b"),
                new SanitizationRule("b", "c"))));

        assertThat(custom.sanitize("ab")).isEqualTo("bc");
    }

    @Test
    @DisplayName("invalid rules rejected")
    void ruleSet_rejectsInvalidRules() {
        assertThatThrownBy(() -> SanitizationRuleSet.of(List.of()))
                .isInstanceOf(OutputReliabilityException.class);
        assertThatThrownBy(() -> SanitizationRuleSet.of(List.of(new SanitizationRule("", "x"))))
                .isInstanceOf(OutputReliabilityException.class);
    }
}
