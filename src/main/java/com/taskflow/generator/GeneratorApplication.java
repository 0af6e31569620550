package com.taskflow.generator;

import com.taskflow.generator.cli.WorkflowCommand;
import picocli.CommandLine;

/**
 * Main entry point for the task workflow generator.
 * Creates and edits task definition sources and drives them through flow scripts.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkflowCommand()).execute(args);
        System.exit(exitCode);
    }
}
