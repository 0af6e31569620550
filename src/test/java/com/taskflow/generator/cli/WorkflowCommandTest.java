package com.taskflow.generator.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.taskflow.generator.cli.output.WorkflowResultsPrinter;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Drives the CLI end to end against a temporary project directory.
 */
class WorkflowCommandTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        cli = new CommandLine(new WorkflowCommand(
                new WorkflowResultsPrinter(new PrintStream(out, true, StandardCharsets.UTF_8))));
    }

    @Test
    void testCreateListAndRead() {
        assertThat(run("create", "SalesRaw", "--code", "result = sourceRows();")).isZero();
        assertThat(run("create", "SalesByRegion", "--code", "result = aggregate(inputs);",
                "--input", "SalesRaw")).isZero();

        assertThat(run("list")).isZero();
        assertThat(output()).contains("SalesRaw").contains("SalesByRegion");

        out.reset();
        assertThat(run("read", "SalesByRegion")).isZero();
        assertThat(output()).contains("result = aggregate(inputs);").contains("save(result);")
                .doesNotContain("inputLoad");

        out.reset();
        assertThat(run("read", "SalesByRegion", "--full")).isZero();
        assertThat(output()).contains("@Input(key = \"SalesRaw\", task = SalesRaw.class)");
    }

    @Test
    void testCreateFromFilesWithSegments() throws IOException {
        Path code = Files.writeString(tempDir.resolve("run.txt"), "result = load();");
        Path check = Files.writeString(tempDir.resolve("check.txt"), "verify(result);");

        assertThat(run("create", "Loader", "-m", "sources", "--code-file", code.toString(),
                "--segment", "check=" + check)).isZero();
        assertThat(run("read", "Loader", "-m", "sources", "--segment", "check")).isZero();
        assertThat(output()).contains("verify(result);");
    }

    @Test
    void testEngineErrorsExitWithOne() {
        assertThat(run("create", "Broken", "--code", "compute();")).isEqualTo(1);
        assertThat(run("delete", "Missing")).isEqualTo(1);
        assertThat(run("create", "NoCode")).isEqualTo(1);
    }

    @Test
    void testUsageErrorsExitWithTwo() {
        assertThat(cli.execute("--base-dir", tempDir.toString(), "frobnicate")).isEqualTo(2);
        assertThat(cli.execute("--base-dir", tempDir.toString())).isEqualTo(2);
        assertThat(cli.execute("--base-dir", tempDir.toString(), "rename", "OnlyOne")).isEqualTo(2);
    }

    @Test
    void testRenameUpdateAndDelete() {
        run("create", "Raw", "--code", "result = 1;");
        run("create", "Cleaned", "--code", "result = 2;", "--input", "Raw");

        assertThat(run("rename", "Raw", "Source")).isZero();
        assertThat(run("update", "Cleaned", "--no-inputs")).isZero();
        assertThat(run("read", "Cleaned", "--full")).isZero();
        assertThat(output()).doesNotContain("@Requires");

        assertThat(run("delete", "Cleaned")).isZero();
        out.reset();
        run("list");
        assertThat(output().strip()).isEqualTo("Source");
    }

    @Test
    void testPreviewWritesScript() throws IOException {
        run("create", "Target", "--code", "result = 1;");

        assertThat(run("preview", "--task", "Target", "--reset", "Target", "--param", "limit=5")).isZero();

        String script = Files.readString(tempDir.resolve("RunPreview.java"));
        assertThat(script).contains("Map.entry(\"limit\", 5)").contains("flow.preview();");
    }

    @Test
    void testRunTaskPrintsScriptWhenNotWritten() {
        run("create", "Target", "--code", "result = 1;");

        assertThat(run("run-task", "--task", "Target", "--no-write")).isZero();
        assertThat(output()).contains("new Target().run();");
        assertThat(tempDir.resolve("RunTask.java")).doesNotExist();
    }

    private int run(String... args) {
        String[] withBase = new String[args.length + 2];
        withBase[0] = "--base-dir";
        withBase[1] = tempDir.toString();
        System.arraycopy(args, 0, withBase, 2, args.length);
        return cli.execute(withBase);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }
}
