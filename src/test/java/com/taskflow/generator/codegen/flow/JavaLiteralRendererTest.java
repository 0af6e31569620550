package com.taskflow.generator.codegen.flow;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.taskflow.generator.codegen.exception.ValidationException;

import static org.assertj.core.api.Assertions.*;

class JavaLiteralRendererTest {

    private final JavaLiteralRenderer renderer = new JavaLiteralRenderer();

    @Test
    void testScalarLiterals() {
        assertThat(renderer.render("say \"hi\"\n")).isEqualTo("\"say \\\"hi\\\"\\n\"");
        assertThat(renderer.render('\'')).isEqualTo("'\\''");
        assertThat(renderer.render(true)).isEqualTo("true");
        assertThat(renderer.render(42)).isEqualTo("42");
        assertThat(renderer.render(42L)).isEqualTo("42L");
        assertThat(renderer.render((short) 7)).isEqualTo("(short) 7");
        assertThat(renderer.render((byte) -1)).isEqualTo("(byte) -1");
        assertThat(renderer.render(1.5)).isEqualTo("1.5");
        assertThat(renderer.render(2.5f)).isEqualTo("2.5f");
        assertThat(renderer.render(Double.NEGATIVE_INFINITY)).isEqualTo("Double.NEGATIVE_INFINITY");
    }

    @Test
    void testMapKeepsEntryOrder() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("region", "EU");
        params.put("limit", 10);

        assertThat(renderer.renderMap(params))
                .isEqualTo("Map.ofEntries(Map.entry(\"region\", \"EU\"), Map.entry(\"limit\", 10))");
        assertThat(renderer.renderMap(Map.of())).isEqualTo("Map.of()");
    }

    @Test
    void testUnsupportedValuesAreReportedTogether() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("missing", null);
        params.put("ratio", Double.NaN);
        params.put("items", List.of(1));
        params.put("ok", "fine");

        assertThatThrownBy(() -> renderer.renderMap(params))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrors())
                        .hasSize(3)
                        .anyMatch(error -> error.startsWith("Parameter 'items'")));
    }

    @Test
    void testArraysAreNotSupported() {
        assertThatThrownBy(() -> renderer.render(Arrays.asList("a", "b")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unsupported value type");
    }
}
