package org.javai.csskit.parser;

import java.util.List;
import org.javai.csskit.ast.CssAst;
import org.javai.csskit.diagnostic.Diagnostic;

/**
 * A best-effort tree and every diagnostic produced on the way to it,
 * lexical ones first. An empty diagnostic list means the input parsed cleanly.
 */
public record ParseResult(CssAst ast, List<Diagnostic> diagnostics) {

	public ParseResult {
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public boolean isClean() {
		return diagnostics.isEmpty();
	}
}
