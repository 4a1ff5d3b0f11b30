package com.docgen.infrastructure.ai.extraction;

import com.docgen.domain.prompt.model.ParsedPromptsResponse;
import com.docgen.infrastructure.ai.ReliabilityFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PromptsResponseBuilderTest {

    private PromptsResponseBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new PromptsResponseBuilder(
                new LenientJsonParser(new ObjectMapper()),
                ReliabilityFixtures.textSanitizer());
    }

    @Test
    @DisplayName("first key becomes the tool name")
    void build_firstKey() {
        Optional<ParsedPromptsResponse> result = builder.build("{\"k1\":[\"p1\"],\"k2\":[\"p2\"]}");

        assertThat(result).contains(new ParsedPromptsResponse("k1", List.of("p1")));
    }

    @Test
    @DisplayName("additional keys are discarded regardless of their order")
    void build_discardsExtraKeys() {
        Optional<ParsedPromptsResponse> result = builder.build("{\"tool\":[\"p1\",\"p2\"],\"tool2\":[\"p3\"]}");

        assertThat(result).isPresent();
        assertThat(result.get().toolName()).isEqualTo("tool");
        assertThat(result.get().prompts()).containsExactly("p1", "p2");
    }

    @Test
    @DisplayName("trailing comma parses the same as clean JSON")
    void build_trailingComma() {
        assertThat(builder.build("{\"a cache list\": [\"x\",\"y\",]}"))
                .isEqualTo(builder.build("{\"a cache list\": [\"x\",\"y\"]}"));
    }

    @Test
    @DisplayName("prompts are sanitized")
    void build_sanitizesPrompts() {
        Optional<ParsedPromptsResponse> result = builder.build(
                "{\"keyvault secret list\": [\"List &quot;secrets&quot; in vault &apos;x&apos;\", \"it’s “ok”\"]}");

        assertThat(result).isPresent();
        assertThat(result.get().prompts()).containsExactly("List \"secrets\" in vault 'x'", "it's \"ok\"");
    }

    @Test
    @DisplayName("present key with empty array is a valid result")
    void build_emptyArray() {
        Optional<ParsedPromptsResponse> result = builder.build("{\"storage blob list\": []}");

        assertThat(result).isPresent();
        assertThat(result.get().toolName()).isEqualTo("storage blob list");
        assertThat(result.get().prompts()).isEmpty();
        assertThat(result.get().hasPrompts()).isFalse();
    }

    @Test
    @DisplayName("empty object yields no result")
    void build_emptyObject() {
        assertThat(builder.build("{}")).isEmpty();
    }

    @Test
    @DisplayName("unparseable, null and empty input yield no result")
    void build_unparseable() {
        assertThat(builder.build("{\"tool\": [\"a\"")).isEmpty();
        assertThat(builder.build(null)).isEmpty();
        assertThat(builder.build("")).isEmpty();
    }

    @Test
    @DisplayName("first value that is not a list of strings yields no result")
    void build_wrongShape() {
        assertThat(builder.build("{\"tool\": \"just one prompt\"}")).isEmpty();
        assertThat(builder.build("{\"tool\": [\"a\", 2]}")).isEmpty();
        assertThat(builder.build("{\"tool\": [\"a\", null]}")).isEmpty();
    }
}
