package com.taskflow.generator.codegen.task;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InputLoadTransformTest {

    private final InputLoadTransform transform = new InputLoadTransform();

    @Test
    void testPrependThenStripGivesBodyBack() {
        String body = "result = rows();\nsave(result);";

        assertThat(transform.strip(transform.prepend(body))).isEqualTo(body);
    }

    @Test
    void testEmptyBodyBecomesLoadStatementOnly() {
        assertThat(transform.prepend("  ")).isEqualTo(InputLoadTransform.STATEMENT);
        assertThat(transform.strip(InputLoadTransform.STATEMENT)).isEmpty();
    }

    @Test
    void testStripLeavesOtherCodeAlone() {
        assertThat(transform.strip("x();\nvar inputs = inputLoad();")).isEqualTo("x();\nvar inputs = inputLoad();");
    }
}
