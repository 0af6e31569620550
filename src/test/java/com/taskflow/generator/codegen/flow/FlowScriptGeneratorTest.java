package com.taskflow.generator.codegen.flow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.taskflow.generator.codegen.WorkflowConfig;
import com.taskflow.generator.codegen.artifact.ArtifactLayout;
import com.taskflow.generator.codegen.artifact.ArtifactStore;
import com.taskflow.generator.codegen.artifact.SourceParser;
import com.taskflow.generator.codegen.artifact.TaskTreeMutator;
import com.taskflow.generator.codegen.exception.NotFoundException;
import com.taskflow.generator.codegen.exception.ValidationException;
import com.taskflow.generator.codegen.model.FlowAction;
import com.taskflow.generator.codegen.model.FlowRequest;
import com.taskflow.generator.codegen.naming.IdentifierPolicy;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for flow script rendering.
 */
class FlowScriptGeneratorTest {

    @TempDir
    Path tempDir;

    private FlowScriptGenerator generator;

    @BeforeEach
    void setUp() throws IOException {
        WorkflowConfig config = WorkflowConfig.builder().baseDir(tempDir).build();
        ArtifactStore store = new ArtifactStore(new ArtifactLayout(config), new SourceParser(), new TaskTreeMutator());
        generator = new FlowScriptGenerator(config, store, IdentifierPolicy.sanitizing());

        Path dir = tempDir.resolve("tasks");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("DefaultModule.java"), "package tasks;\npublic final class DefaultModule {\n"
                + "public static class A {}\npublic static class B {}\npublic static class T {}\n}\n");
        Files.writeString(dir.resolve("sales.java"), "package tasks;\npublic final class sales {\npublic static class Totals {}\n}\n");
    }

    @Test
    void testPreviewWithResetsInOrder() {
        String script = generator.build(FlowRequest.builder()
                .task("T")
                .resetTask("A")
                .resetTask("B")
                .action(FlowAction.PREVIEW)
                .build());

        int resetA = script.indexOf("flow.reset(DefaultModule.A.class);");
        int resetB = script.indexOf("flow.reset(DefaultModule.B.class);");
        int preview = script.indexOf("flow.preview();");
        assertThat(resetA).isPositive();
        assertThat(resetB).isGreaterThan(resetA);
        assertThat(preview).isGreaterThan(resetB);
        assertThat(script.split("flow\\.reset\\(", -1)).hasSize(3);
        assertThat(script).doesNotContain("flow.run();");
        assertThat(script).contains("class RunPreview");
        assertThat(script).contains("import tasks.DefaultModule;");
        assertThat(script).contains("Class<? extends PersistedTask> task = DefaultModule.T.class;");
    }

    @Test
    void testRunScriptWithParamsResetTargetAndOutput() {
        String script = generator.build(FlowRequest.builder()
                .task("totals")
                .module("sales")
                .param("region", "EU")
                .resetTarget(true)
                .loadOutput(true)
                .build());

        assertThat(script).startsWith("import taskflow.*;\nimport java.util.*;\nimport tasks.sales;\n");
        assertThat(script).contains("Map<String, Object> params = Map.ofEntries(Map.entry(\"region\", \"EU\"));");
        assertThat(script).contains("Class<? extends PersistedTask> task = sales.Totals.class;");
        assertThat(script).contains("Workflow flow = new Workflow(task, params);");
        assertThat(script.indexOf("flow.reset(task);")).isLessThan(script.indexOf("flow.run();"));
        assertThat(script).contains("System.out.println(flow.outputLoad(task));");
        assertThat(script).doesNotContain("flow.preview();");
    }

    @Test
    void testUnknownResetTaskIsKept() {
        String script = generator.build(FlowRequest.builder().task("T").resetTask("ghost task").build());

        assertThat(script).contains("flow.reset(DefaultModule.GhostTask.class);");
    }

    @Test
    void testMissingTargetIsNotFound() {
        assertThatThrownBy(() -> generator.build(FlowRequest.builder().task("Nope").build()))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("[A, B, T]");
        assertThatThrownBy(() -> generator.build(FlowRequest.builder().task("T").module("ghost").build()))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("File tasks/ghost.java not found");
    }

    @Test
    void testTaskCallScript() {
        String script = generator.buildTaskCall("Totals", "output", "sales");

        assertThat(script).contains("class RunTask").contains("new sales.Totals().output();");
        assertThatThrownBy(() -> generator.buildTaskCall("Totals", "not valid", "sales"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> generator.buildTaskCall("Totals", "class", "sales"))
                .isInstanceOf(ValidationException.class);
    }
}
