package org.javai.csskit.tokenizer;

/**
 * Switches controlling what the tokenizer emits.
 *
 * @param preserveWhitespace emit WHITESPACE tokens instead of dropping whitespace
 * @param preserveComments emit COMMENT tokens instead of dropping comments
 * @param recognizeColors classify {@code #rgb} runs in values as COLOR tokens
 * @param recognizeFunctions classify {@code name(} as FUNCTION + OPEN_PAREN and {@code url(...)} as URL
 */
public record TokenizerOptions(
	boolean preserveWhitespace,
	boolean preserveComments,
	boolean recognizeColors,
	boolean recognizeFunctions
) {

	public static TokenizerOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.preserveWhitespace(preserveWhitespace)
				.preserveComments(preserveComments)
				.recognizeColors(recognizeColors)
				.recognizeFunctions(recognizeFunctions);
	}

	public static final class Builder {
		private boolean preserveWhitespace = false;
		private boolean preserveComments = true;
		private boolean recognizeColors = true;
		private boolean recognizeFunctions = true;

		private Builder() {
		}

		public Builder preserveWhitespace(boolean preserveWhitespace) {
			this.preserveWhitespace = preserveWhitespace;
			return this;
		}

		public Builder preserveComments(boolean preserveComments) {
			this.preserveComments = preserveComments;
			return this;
		}

		public Builder recognizeColors(boolean recognizeColors) {
			this.recognizeColors = recognizeColors;
			return this;
		}

		public Builder recognizeFunctions(boolean recognizeFunctions) {
			this.recognizeFunctions = recognizeFunctions;
			return this;
		}

		public TokenizerOptions build() {
			return new TokenizerOptions(preserveWhitespace, preserveComments, recognizeColors, recognizeFunctions);
		}
	}
}
