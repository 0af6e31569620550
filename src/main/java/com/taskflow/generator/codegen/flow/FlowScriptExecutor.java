package com.taskflow.generator.codegen.flow;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.taskflow.generator.codegen.WorkflowConfig;
import com.taskflow.generator.codegen.model.ExecutionResult;
import com.taskflow.generator.codegen.model.ExecutionStatus;

/**
 * Runs a flow script as a single-file Java program in a child process.
 *
 * <p>Never throws for launch failures, non-zero exits or timeouts; those come back
 * as the result status. The temporary script file is removed before returning.
 */
public class FlowScriptExecutor {

    private static final Logger log = LoggerFactory.getLogger(FlowScriptExecutor.class);

    private static final Duration OUTPUT_GRACE = Duration.ofSeconds(5);

    private final WorkflowConfig config;

    public FlowScriptExecutor(WorkflowConfig config) {
        this.config = config;
    }

    public ExecutionResult execute(String script) {
        Instant start = Instant.now();
        Path scriptFile = null;
        try {
            scriptFile = Files.createTempFile("flow-", ".java");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);
            return launch(scriptFile, start);
        } catch (IOException e) {
            log.error("Failed to launch flow script: {}", e.getMessage());
            return failure(ExecutionStatus.LAUNCH_FAILED, scriptFile, start, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for flow script");
            return failure(ExecutionStatus.LAUNCH_FAILED, scriptFile, start, "Interrupted");
        } finally {
            deleteScript(scriptFile);
        }
    }

    List<String> command(Path scriptFile) {
        List<String> command = new ArrayList<>();
        command.add(config.getJavaExecutable().toString());
        String classpath = config.getRuntimeClasspath();
        if (classpath != null && !classpath.isBlank()) {
            command.add("-cp");
            command.add(classpath);
        }
        command.add(scriptFile.toString());
        return command;
    }

    private ExecutionResult launch(Path scriptFile, Instant start) throws IOException, InterruptedException {
        Files.createDirectories(config.getBaseDir());
        List<String> command = command(scriptFile);
        log.debug("Running {} in {}", command, config.getBaseDir());

        Process process = new ProcessBuilder(command)
                .directory(config.getBaseDir().toFile())
                .start();
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        Duration timeout = config.getExecutionTimeout();
        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            process.waitFor(OUTPUT_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            log.error("Flow script timed out after {} s", timeout.toSeconds());
            return ExecutionResult.builder()
                    .status(ExecutionStatus.TIMED_OUT)
                    .stdout(collect(stdout))
                    .stderr(collect(stderr) + "Timed out after " + timeout.toSeconds() + " s")
                    .scriptFile(scriptFile)
                    .elapsed(Duration.between(start, Instant.now()))
                    .build();
        }

        int exitCode = process.exitValue();
        ExecutionStatus status = exitCode == 0 ? ExecutionStatus.SUCCEEDED : ExecutionStatus.FAILED;
        if (status == ExecutionStatus.FAILED) {
            log.error("Flow script exited with code {}", exitCode);
        } else {
            log.info("Flow script finished in {} ms", Duration.between(start, Instant.now()).toMillis());
        }
        return ExecutionResult.builder()
                .status(status)
                .exitCode(exitCode)
                .stdout(collect(stdout))
                .stderr(collect(stderr))
                .scriptFile(scriptFile)
                .elapsed(Duration.between(start, Instant.now()))
                .build();
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(OUTPUT_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not collect process output: {}", e.getMessage());
            return "";
        }
    }

    private static ExecutionResult failure(ExecutionStatus status, Path scriptFile, Instant start, String message) {
        return ExecutionResult.builder()
                .status(status)
                .stderr(message == null ? "" : message)
                .scriptFile(scriptFile)
                .elapsed(Duration.between(start, Instant.now()))
                .build();
    }

    private static void deleteScript(Path scriptFile) {
        if (scriptFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(scriptFile);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", scriptFile, e.getMessage());
        }
    }
}
