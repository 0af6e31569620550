package com.taskflow.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by every subcommand. No validation, no execution logic, no
 * printing.
 */
@Getter
public class EngineOptions {

	@Option(names = { "--base-dir", "-d" }, description = "Project directory holding the task package (defaults to current directory)")
	private Path baseDir;

	@Option(names = { "--base-package" }, defaultValue = "tasks", description = "Package of the default module (default: tasks)")
	private String basePackage;

	@Option(names = { "--strict" }, description = "Reject malformed names instead of cleaning them up")
	private boolean strict;

	@Option(names = { "--timeout-seconds" }, defaultValue = "300", description = "Timeout for executed flow scripts (default: 300)")
	private long timeoutSeconds;

	@Option(names = { "--classpath", "-cp" }, description = "Class path for executed flow scripts")
	private String classpath;
}
