package org.javai.csskit.token;

/**
 * An immutable, classified piece of stylesheet source.
 * <p>
 * Tokens are created through {@link CssTokenBuilder} only, which validates the
 * kind and position and fills the kind-specific fields.
 *
 * @param id per-run identifier handed out by a {@link TokenIdAllocator}
 * @param type the token kind
 * @param value the token text ({@code ""} for EOF)
 * @param position where the token was found
 * @param numericValue parsed value of a NUMBER token, {@code null} otherwise
 * @param detail the url of a URL token, the keyword of an AT_KEYWORD token,
 *               the name of a FUNCTION token, {@code null} otherwise
 */
public record CssToken(
	int id,
	CssTokenType type,
	String value,
	TokenPosition position,
	Double numericValue,
	String detail
) {

	public int line() {
		return position.line();
	}

	public int column() {
		return position.column();
	}

	public int start() {
		return position.start();
	}

	public int end() {
		return position.end();
	}

	public boolean isType(CssTokenType expectedType) {
		return type == expectedType;
	}

	public boolean isSelector() {
		return type.isSelector();
	}

	public boolean isValue() {
		return type.isValue();
	}

	/**
	 * Deterministic fingerprint of this token's observable content, used as a
	 * refinement key. Position and id are deliberately left out.
	 */
	public String signature() {
		return type + ":" + value;
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")@" + line() + ":" + column();
			case EOF -> "EOF@" + line() + ":" + column();
			default -> type + "(" + value + ")@" + line() + ":" + column();
		};
	}
}
