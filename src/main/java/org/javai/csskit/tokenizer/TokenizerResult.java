package org.javai.csskit.tokenizer;

import java.util.List;
import org.javai.csskit.diagnostic.Diagnostic;
import org.javai.csskit.token.CssToken;

/**
 * Output of one tokenizer run. The token list always ends with an EOF token.
 */
public record TokenizerResult(List<CssToken> tokens, List<Diagnostic> diagnostics) {

	public TokenizerResult {
		tokens = List.copyOf(tokens);
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public boolean isClean() {
		return diagnostics.isEmpty();
	}
}
