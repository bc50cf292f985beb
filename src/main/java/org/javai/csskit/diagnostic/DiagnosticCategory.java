package org.javai.csskit.diagnostic;

/**
 * Where in the pipeline a diagnostic originated.
 */
public enum DiagnosticCategory {
	LEXICAL,       // unrecognized character run, brace mismatch, unterminated construct
	SYNTACTIC,     // unexpected token in the current parser state
	STRUCTURAL     // a structural reader could not interpret a token run
}
