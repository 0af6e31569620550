package com.taskflow.generator.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.taskflow.generator.codegen.WorkflowConfig;
import com.taskflow.generator.codegen.WorkflowService;
import com.taskflow.generator.codegen.model.FlowRequest;
import com.taskflow.generator.codegen.model.FlowScriptResult;
import com.taskflow.generator.codegen.model.InputReference;
import com.taskflow.generator.codegen.model.TaskDefinition;
import com.taskflow.generator.codegen.model.TaskUpdate;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for building a small multi-module workflow.
 */
class WorkflowIntegrationTest {

    @TempDir
    Path tempDir;

    private WorkflowService service;

    @BeforeEach
    void setUp() {
        service = new WorkflowService(WorkflowConfig.builder().baseDir(tempDir).build());
    }

    @Test
    void testSameModuleDependencyRoundTrip() throws IOException {
        service.create(TaskDefinition.builder().name("SalesRaw").segment("run", "result = sourceRows();").build());
        service.update(TaskUpdate.builder()
                .name("SalesRaw")
                .segments(Map.of("run", "result = sourceRows();"))
                .build());
        service.create(TaskDefinition.builder()
                .name("SalesByRegion")
                .segment("run", "result = aggregate(inputs);")
                .inputs(List.of(InputReference.of("SalesRaw")))
                .build());

        String artifact = Files.readString(tempDir.resolve("tasks/DefaultModule.java"));
        assertThat(artifact).contains("@Requires({ @Input(key = \"SalesRaw\", task = SalesRaw.class) })");
        assertThat(artifact.lines().filter(line -> line.startsWith("import "))).containsExactly(
                "import taskflow.*;", "import java.util.*;");
        assertThat(service.read("SalesRaw", null, null)).doesNotContain("@Requires");
    }

    @Test
    void testCrossModuleDependency() throws IOException {
        service.create(TaskDefinition.builder()
                .name("RawCsv")
                .module("sources")
                .segment("run", "result = readCsv(\"orders.csv\");")
                .build());
        service.create(TaskDefinition.builder()
                .name("Enriched")
                .module("analysis")
                .segment("run", "result = enrich(inputs);")
                .inputs(List.of(InputReference.of("sources", "RawCsv")))
                .build());

        String artifact = Files.readString(tempDir.resolve("tasks/analysis.java"));
        assertThat(artifact).startsWith("package tasks;");
        assertThat(artifact).contains("import tasks.sources;");
        assertThat(artifact).contains("public final class analysis {");
        assertThat(artifact).contains("@Input(key = \"sources.RawCsv\", task = sources.RawCsv.class)");
        assertThat(artifact.indexOf("import java.util.*;")).isLessThan(artifact.indexOf("import tasks.sources;"));
        assertThat(service.listModules()).containsExactly("analysis", "sources");
    }

    @Test
    void testRenameLeavesOtherModulesAlone() throws IOException {
        service.create(TaskDefinition.builder().name("RawCsv").module("sources").segment("run", "result = 1;").build());
        service.create(TaskDefinition.builder()
                .name("Enriched")
                .module("analysis")
                .segment("run", "result = 2;")
                .inputs(List.of(InputReference.of("sources", "RawCsv")))
                .build());

        service.rename("RawCsv", "OrdersCsv", "sources");

        assertThat(service.listTasks("sources")).containsExactly("OrdersCsv");
        assertThat(Files.readString(tempDir.resolve("tasks/analysis.java")))
                .contains("task = sources.RawCsv.class");
    }

    @Test
    void testFlowScriptsAreWrittenNextToProject() throws IOException {
        service.create(TaskDefinition.builder().name("Report").module("reports").segment("run", "result = 1;").build());

        FlowScriptResult preview = service.flows().preview(FlowRequest.builder()
                .task("Report")
                .module("reports")
                .param("year", 2024)
                .build(), false);
        FlowScriptResult inline = service.flows().run(FlowRequest.builder()
                .task("Report")
                .module("reports")
                .build(), null, false);

        assertThat(preview.getWrittenTo()).contains(tempDir.resolve("RunPreview.java"));
        assertThat(Files.readString(tempDir.resolve("RunPreview.java"))).isEqualTo(preview.getScript());
        assertThat(preview.getScript()).contains("flow.preview();").doesNotContain("flow.run();");
        assertThat(preview.getExecution()).isEmpty();
        assertThat(inline.getWrittenTo()).isEmpty();
        assertThat(inline.getScript()).contains("flow.run();");
        assertThat(tempDir.resolve("RunFlow.java")).doesNotExist();
    }
}
