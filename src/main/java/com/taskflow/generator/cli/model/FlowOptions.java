package com.taskflow.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options for the preview and run subcommands.
 */
@Getter
public class FlowOptions {

	@Option(names = { "--task", "-t" }, required = true, description = "Target task")
	private String task;

	@Option(names = { "--module", "-m" }, description = "Module of the target task (defaults to the default module)")
	private String module;

	@Option(names = { "--param", "-p" }, description = "Flow parameter as key=value, repeatable")
	private Map<String, String> params = new LinkedHashMap<>();

	@Option(names = { "--reset", "-r" }, description = "Task to reset before the flow, repeatable")
	private List<String> resetTasks = new ArrayList<>();

	@Option(names = { "--reset-target" }, description = "Also reset the target task")
	private boolean resetTarget;

	@Option(names = { "--load-output" }, description = "Print the target's output afterwards")
	private boolean loadOutput;

	@Option(names = { "--out", "-o" }, description = "Where to write the script, relative to the base directory")
	private Path out;

	@Option(names = { "--no-write" }, description = "Do not write the script to a file")
	private boolean noWrite;

	@Option(names = { "--execute", "-x" }, description = "Run the script after rendering it")
	private boolean execute;
}
