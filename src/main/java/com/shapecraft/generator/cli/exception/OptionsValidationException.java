package com.shapecraft.generator.cli.exception;

import java.util.List;

/**
 * Every problem found in the "generate" options, reported together.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(errors.size() + " invalid option(s): " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
	}

	public OptionsValidationException(String error, Throwable cause) {
		super(error, cause);
		this.errors = List.of(error);
	}

	/** Messages in the order the options were checked. */
	public List<String> getErrors() {
		return errors;
	}
}
