package com.baseobject.cli.exception;

import java.util.List;

/**
 * Rejected options of a subcommand.
 *
 * The message reads {@code "<command>: <n> invalid option(s): <first>; <second>"};
 * {@link #getErrors()} keeps each problem on its own for line-by-line reporting.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String command;
	private final List<String> errors;

	public OptionsValidationException(String command, List<String> errors) {
		super(command + ": " + errors.size() + " invalid option(s): " + String.join("; ", errors));
		this.command = command;
		this.errors = List.copyOf(errors);
	}

	public String getCommand() {
		return command;
	}

	public List<String> getErrors() {
		return errors;
	}
}
