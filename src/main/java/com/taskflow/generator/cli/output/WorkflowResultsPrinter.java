package com.taskflow.generator.cli.output;

import java.io.PrintStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.taskflow.generator.codegen.model.ExecutionResult;
import com.taskflow.generator.codegen.model.FlowScriptResult;

/**
 * Responsible only for printing CLI output. Status lines go to the log; source,
 * listings and scripts go to the output stream so they can be piped.
 */
public class WorkflowResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(WorkflowResultsPrinter.class);

    private final PrintStream out;

    public WorkflowResultsPrinter() {
        this(System.out);
    }

    public WorkflowResultsPrinter(PrintStream out) {
        this.out = out;
    }

    public void printStatus(String status) {
        log.info(status);
    }

    public void printSource(String source) {
        out.println(source);
    }

    public void printList(List<String> names) {
        names.forEach(out::println);
    }

    public void printErrors(List<String> errors) {
        errors.forEach(error -> log.error("  - {}", error));
    }

    public void printFlow(FlowScriptResult result) {
        if (result.getWrittenTo().isPresent()) {
            log.info("Script written to {}", result.getWrittenTo().get());
        } else if (result.getExecution().isEmpty()) {
            out.println(result.getScript());
        }
        result.getExecution().ifPresent(this::printExecution);
    }

    public void printExecution(ExecutionResult execution) {
        log.info("=================================================");
        log.info("Status: {}", execution.getStatus());
        if (execution.getExitCode() != ExecutionResult.NO_EXIT_CODE) {
            log.info("Exit code: {}", execution.getExitCode());
        }
        log.info("Elapsed: {} ms", execution.getElapsed().toMillis());
        log.info("=================================================");
        if (!execution.getStdout().isEmpty()) {
            out.print(execution.getStdout());
        }
        if (!execution.getStderr().isEmpty()) {
            log.warn("stderr:{}{}", System.lineSeparator(), execution.getStderr());
        }
    }
}
