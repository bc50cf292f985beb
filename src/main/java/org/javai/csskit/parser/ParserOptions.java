package org.javai.csskit.parser;

import org.javai.csskit.tokenizer.TokenizerOptions;

/**
 * Switches controlling a parse.
 *
 * @param tokenizer options for the tokenizer run that precedes parsing
 * @param errorRecovery resynchronize after a syntactic error; when false parsing
 *                      stops at the first error and the partial tree is returned
 * @param stateMinimization minimize the parser automaton and attach its metrics to the tree
 * @param astOptimization minimize the tree nodes and attach the node metrics
 * @param preserveComments turn comment tokens into COMMENT nodes
 * @param parseNestedRules nest rules and at-rules found in at-rule blocks under the
 *                         at-rule; when false they are attached to the stylesheet root
 */
public record ParserOptions(
	TokenizerOptions tokenizer,
	boolean errorRecovery,
	boolean stateMinimization,
	boolean astOptimization,
	boolean preserveComments,
	boolean parseNestedRules
) {

	public ParserOptions {
		tokenizer = tokenizer != null ? tokenizer : TokenizerOptions.defaults();
	}

	public static ParserOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private TokenizerOptions tokenizer = TokenizerOptions.defaults();
		private boolean errorRecovery = true;
		private boolean stateMinimization = true;
		private boolean astOptimization = false;
		private boolean preserveComments = false;
		private boolean parseNestedRules = true;

		private Builder() {
		}

		public Builder tokenizer(TokenizerOptions tokenizer) {
			this.tokenizer = tokenizer;
			return this;
		}

		public Builder errorRecovery(boolean errorRecovery) {
			this.errorRecovery = errorRecovery;
			return this;
		}

		public Builder stateMinimization(boolean stateMinimization) {
			this.stateMinimization = stateMinimization;
			return this;
		}

		public Builder astOptimization(boolean astOptimization) {
			this.astOptimization = astOptimization;
			return this;
		}

		public Builder preserveComments(boolean preserveComments) {
			this.preserveComments = preserveComments;
			return this;
		}

		public Builder parseNestedRules(boolean parseNestedRules) {
			this.parseNestedRules = parseNestedRules;
			return this;
		}

		public ParserOptions build() {
			return new ParserOptions(tokenizer, errorRecovery, stateMinimization, astOptimization,
					preserveComments, parseNestedRules);
		}
	}
}
