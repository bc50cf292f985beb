package org.javai.csskit.reader;

import java.util.List;
import org.javai.csskit.diagnostic.Diagnostic;

/**
 * Outcome of one structural read.
 *
 * @param value what was read; may be present even when {@code success} is false
 *              if the reader could salvage a partial construct
 * @param endIndex index of the first token not consumed by the read
 * @param success whether the construct was read without problems
 * @param errors structural diagnostics explaining a failure
 * @param <T> the kind of construct read
 */
public record ReadResult<T>(T value, int endIndex, boolean success, List<Diagnostic> errors) {

	public ReadResult {
		errors = List.copyOf(errors);
	}

	static <T> ReadResult<T> success(T value, int endIndex) {
		return new ReadResult<>(value, endIndex, true, List.of());
	}

	static <T> ReadResult<T> partial(T value, int endIndex, List<Diagnostic> errors) {
		return new ReadResult<>(value, endIndex, errors.isEmpty(), errors);
	}

	static <T> ReadResult<T> failure(int endIndex, Diagnostic error) {
		return new ReadResult<>(null, endIndex, false, List.of(error));
	}
}
