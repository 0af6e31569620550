package com.taskflow.generator.cli.model;

import java.util.List;
import java.util.Map;

import com.taskflow.generator.codegen.model.InputReference;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Task source read from the command line and the files it points to.
 */
@Data
@AllArgsConstructor
public class ValidatedTaskSource {

	/** Segment name to body; empty when no code was given. */
	private Map<String, String> segments;

	/** Null when the inputs should stay as they are. */
	private List<InputReference> inputs;

	/** Null when no import lines were given. */
	private String imports;
}
