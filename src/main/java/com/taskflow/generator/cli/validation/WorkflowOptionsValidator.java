package com.taskflow.generator.cli.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import javax.lang.model.SourceVersion;

import com.taskflow.generator.cli.exception.OptionsValidationException;
import com.taskflow.generator.cli.model.EngineOptions;
import com.taskflow.generator.cli.model.TaskSourceOptions;
import com.taskflow.generator.cli.model.ValidatedTaskSource;
import com.taskflow.generator.codegen.WorkflowConfig;
import com.taskflow.generator.codegen.model.InputReference;
import com.taskflow.generator.codegen.task.TaskConventions;

public class WorkflowOptionsValidator {

	private static final Pattern INTEGER = Pattern.compile("-?\\d+");
	private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

	public WorkflowConfig validate(EngineOptions o) {
		List<String> errors = new ArrayList<>();

		Path baseDir = (o.getBaseDir() == null ? Path.of(".") : o.getBaseDir()).toAbsolutePath().normalize();
		if (Files.exists(baseDir) && !Files.isDirectory(baseDir)) {
			errors.add("Base directory is not a directory: " + baseDir);
		}
		if (isBlank(o.getBasePackage()) || !SourceVersion.isName(o.getBasePackage())) {
			errors.add("Base package must be a valid Java package name. Got: " + o.getBasePackage());
		}
		if (o.getTimeoutSeconds() <= 0) {
			errors.add("Timeout must be > 0 seconds. Got: " + o.getTimeoutSeconds());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return WorkflowConfig.builder()
				.baseDir(baseDir)
				.basePackage(o.getBasePackage())
				.strictIdentifiers(o.isStrict())
				.executionTimeout(Duration.ofSeconds(o.getTimeoutSeconds()))
				.runtimeClasspath(o.getClasspath())
				.build();
	}

	/**
	 * @param requireCode whether the run segment body must be supplied
	 */
	public ValidatedTaskSource validate(TaskSourceOptions s, boolean requireCode) {
		List<String> errors = new ArrayList<>();
		Map<String, String> segments = new LinkedHashMap<>();

		if (s.getCode() != null && s.getCodeFile() != null) {
			errors.add("Use either --code or --code-file, not both.");
		} else if (s.getCode() != null) {
			segments.put(TaskConventions.PRIMARY_SEGMENT, s.getCode());
		} else if (s.getCodeFile() != null) {
			String code = readFile(s.getCodeFile(), errors);
			if (code != null) {
				segments.put(TaskConventions.PRIMARY_SEGMENT, code);
			}
		} else if (requireCode) {
			errors.add("The run segment is required (--code / --code-file).");
		}

		for (Map.Entry<String, Path> segment : s.getSegmentFiles().entrySet()) {
			if (segment.getKey().equals(TaskConventions.PRIMARY_SEGMENT)) {
				errors.add("Pass the run segment with --code or --code-file, not --segment.");
				continue;
			}
			String body = readFile(segment.getValue(), errors);
			if (body != null) {
				segments.put(segment.getKey(), body);
			}
		}

		List<InputReference> inputs = null;
		if (s.isClearInputs()) {
			if (!s.getInputs().isEmpty()) {
				errors.add("Use either --input or --no-inputs, not both.");
			}
			inputs = List.of();
		} else if (!s.getInputs().isEmpty()) {
			inputs = parseInputs(s.getInputs(), errors);
		}

		String imports = s.getImports().isEmpty() ? null : String.join("\n", s.getImports());

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return new ValidatedTaskSource(segments, inputs, imports);
	}

	/**
	 * Gives parameter values a Java type: booleans, whole numbers and decimals are
	 * recognised, everything else stays a string.
	 */
	public Map<String, Object> parseParams(Map<String, String> raw) {
		Map<String, Object> params = new LinkedHashMap<>();
		raw.forEach((key, value) -> params.put(key, typed(value)));
		return params;
	}

	static Object typed(String value) {
		if (value.equals("true") || value.equals("false")) {
			return Boolean.valueOf(value);
		}
		if (INTEGER.matcher(value).matches()) {
			try {
				long number = Long.parseLong(value);
				return number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE ? (Object) (int) number : number;
			} catch (NumberFormatException e) {
				return value;
			}
		}
		if (DECIMAL.matcher(value).matches()) {
			return Double.valueOf(value);
		}
		return value;
	}

	static List<InputReference> parseInputs(List<String> raw, List<String> errors) {
		List<InputReference> inputs = new ArrayList<>();
		for (String input : raw) {
			int colon = input.indexOf(':');
			if (colon < 0) {
				if (isBlank(input)) {
					errors.add("Input must name a task.");
				} else {
					inputs.add(InputReference.of(input.trim()));
				}
				continue;
			}
			String module = input.substring(0, colon).trim();
			String task = input.substring(colon + 1).trim();
			if (module.isEmpty() || task.isEmpty()) {
				errors.add("Input must be Task or module:Task. Got: " + input);
			} else {
				inputs.add(InputReference.of(module, task));
			}
		}
		return inputs;
	}

	private static String readFile(Path file, List<String> errors) {
		if (!Files.isRegularFile(file)) {
			errors.add("Code file does not exist: " + file);
			return null;
		}
		try {
			return Files.readString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			errors.add("Could not read " + file + ": " + e.getMessage());
			return null;
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
