package com.taskflow.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Where a task's source comes from for create, upsert and update.
 */
@Getter
public class TaskSourceOptions {

	@Option(names = { "--code", "-c" }, description = "Body of the run segment")
	private String code;

	@Option(names = { "--code-file" }, description = "File holding the body of the run segment")
	private Path codeFile;

	@Option(names = { "--segment", "-s" }, description = "Additional segment as name=file, repeatable")
	private Map<String, Path> segmentFiles = new LinkedHashMap<>();

	@Option(names = { "--input", "-i" }, description = "Upstream task as Task or module:Task, repeatable")
	private List<String> inputs = new ArrayList<>();

	@Option(names = { "--no-inputs" }, description = "Remove every declared input (update only)")
	private boolean clearInputs;

	@Option(names = { "--import" }, description = "Extra import line, repeatable")
	private List<String> imports = new ArrayList<>();
}
