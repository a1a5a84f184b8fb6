package com.chemdata.dwar.cli.exception;

import java.util.List;

/**
 * Every problem found in the convert options, reported together.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	public boolean mentions(String fragment) {
		return errors.stream().anyMatch(e -> e.contains(fragment));
	}
}
