package io.verso.core.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonTextTest {

    @Test
    void shouldRenderNestedValuesWithIndentation() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("title", "Ledger");
        value.put("sections", List.of(1, true));
        value.put("empty", Map.of());

        assertThat(JsonText.render(value))
                .isEqualTo(
                        "{\n"
                                + "  \"title\": \"Ledger\",\n"
                                + "  \"sections\": [\n"
                                + "    1,\n"
                                + "    true\n"
                                + "  ],\n"
                                + "  \"empty\": {}\n"
                                + "}");
    }

    @Test
    void shouldEscapeControlCharacters() {
        assertThat(JsonText.escape("a\"b\\c\nd\u0001")).isEqualTo("a\\\"b\\\\c\\nd\\u0001");
    }

    @Test
    void shouldRenderNullAndOtherTypes() {
        assertThat(JsonText.render(null)).isEqualTo("null");
        assertThat(JsonText.render(Duration.ofSeconds(1))).isEqualTo("\"PT1S\"");
    }

    @Test
    void shouldRenderNonFiniteNumbersAsNull() {
        Map<String, Object> scores = new LinkedHashMap<>();
        scores.put("tone", Double.NaN);
        scores.put("depth", Double.POSITIVE_INFINITY);
        scores.put("length", Float.NEGATIVE_INFINITY);
        scores.put("accuracy", 0.5);

        assertThat(JsonText.render(scores))
                .isEqualTo(
                        "{\n"
                                + "  \"tone\": null,\n"
                                + "  \"depth\": null,\n"
                                + "  \"length\": null,\n"
                                + "  \"accuracy\": 0.5\n"
                                + "}");
    }
}
