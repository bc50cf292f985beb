package org.javai.csskit.config;

import org.javai.csskit.automaton.MinimizerOptions;
import org.javai.csskit.parser.ParserOptions;
import org.javai.csskit.tokenizer.TokenizerOptions;

/**
 * Settings for the whole pipeline.
 *
 * @param tokenizer tokenizer switches; also carried inside {@code parser}
 * @param parser parser switches
 * @param minimizer minimizer switches
 */
public record CssKitConfig(TokenizerOptions tokenizer, ParserOptions parser, MinimizerOptions minimizer) {

	public CssKitConfig {
		tokenizer = tokenizer != null ? tokenizer : TokenizerOptions.defaults();
		parser = parser != null ? parser : ParserOptions.builder().tokenizer(tokenizer).build();
		minimizer = minimizer != null ? minimizer : MinimizerOptions.defaults();
	}

	public static CssKitConfig defaults() {
		return new CssKitConfig(null, null, null);
	}
}
