package org.javai.csskit;

/**
 * Root of the exceptions thrown by the stylesheet pipeline.
 * <p>
 * Lexical and syntactic problems are never thrown; they are reported as
 * diagnostics alongside a best-effort result.
 */
public class CssKitException extends RuntimeException {

	public CssKitException(String message) {
		super(message);
	}

	public CssKitException(String message, Throwable cause) {
		super(message, cause);
	}
}
