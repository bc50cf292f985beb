package org.javai.csskit.diagnostic;

import java.util.Objects;

/**
 * A non-fatal problem found while tokenizing, reading or parsing.
 *
 * @param category the pipeline stage that reported the problem
 * @param severity warning or error
 * @param message human readable description
 * @param line 1-based line of the offending input
 * @param column 1-based column of the offending input
 * @param start offset of the first offending character
 * @param end offset one past the last offending character
 */
public record Diagnostic(
	DiagnosticCategory category,
	Severity severity,
	String message,
	int line,
	int column,
	int start,
	int end
) {

	public Diagnostic {
		Objects.requireNonNull(category, "category must not be null");
		Objects.requireNonNull(severity, "severity must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	public static Diagnostic error(DiagnosticCategory category, String message, int line, int column, int start, int end) {
		return new Diagnostic(category, Severity.ERROR, message, line, column, start, end);
	}

	public static Diagnostic warning(DiagnosticCategory category, String message, int line, int column, int start, int end) {
		return new Diagnostic(category, Severity.WARNING, message, line, column, start, end);
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		return severity + " " + category + " at " + line + ":" + column + ": " + message;
	}
}
