package org.javai.csskit.token;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validated factory for {@link CssToken}s.
 * <p>
 * Every builder owns a {@link TokenIdAllocator}; a tokenizer run creates one
 * builder, so token ids are scoped to that run. Building is otherwise free of
 * side effects: a rejected request throws {@link MalformedTokenException} and
 * leaves previously built tokens untouched.
 */
public final class CssTokenBuilder {

	private static final Logger logger = LoggerFactory.getLogger(CssTokenBuilder.class);

	private static final Pattern URL_PATTERN = Pattern.compile("(?i)url\\(\\s*['\"]?([^'\"()]*?)['\"]?\\s*\\)");
	private static final String IMPORTANT = "!important";

	private final TokenIdAllocator ids;

	public CssTokenBuilder() {
		this(new TokenIdAllocator());
	}

	public CssTokenBuilder(TokenIdAllocator ids) {
		if (ids == null) {
			throw new IllegalArgumentException("Token id allocator cannot be null");
		}
		this.ids = ids;
	}

	/**
	 * Builds a token from a symbolic kind name such as {@code "Property"} or
	 * {@code "class-selector"}.
	 *
	 * @throws MalformedTokenException if the name is not part of the token alphabet
	 *                                 or the position is invalid
	 */
	public CssToken create(String typeName, String value, TokenPosition position) {
		CssTokenType type = CssTokenType.fromName(typeName)
				.orElseThrow(() -> new MalformedTokenException("Invalid token type: " + typeName));
		return create(type, value, position);
	}

	/**
	 * Builds a token of the given kind.
	 *
	 * @throws MalformedTokenException if the kind is null, the value is missing
	 *                                 where the kind needs one, or the position is invalid
	 */
	public CssToken create(CssTokenType type, String value, TokenPosition position) {
		if (type == null) {
			throw new MalformedTokenException("Token type cannot be null");
		}
		validatePosition(position);

		return switch (type) {
			case START_BLOCK -> fixed(type, "{", position);
			case END_BLOCK -> fixed(type, "}", position);
			case SEMICOLON -> fixed(type, ";", position);
			case COLON -> fixed(type, ":", position);
			case COMMA -> fixed(type, ",", position);
			case OPEN_PAREN -> fixed(type, "(", position);
			case CLOSE_PAREN -> fixed(type, ")", position);
			case IMPORTANT_FLAG -> fixed(type, IMPORTANT, position);
			case EOF -> fixed(type, "", position);
			case PSEUDO_CLASS -> {
				String name = stripPrefix(required(type, value), ":");
				yield token(type, ":" + name, position, null, null);
			}
			case PSEUDO_ELEMENT -> {
				String name = stripPrefix(required(type, value), "::");
				yield token(type, "::" + name, position, null, null);
			}
			case AT_KEYWORD -> {
				String keyword = stripPrefix(required(type, value), "@");
				yield token(type, "@" + keyword, position, null, keyword);
			}
			case NUMBER -> {
				String text = required(type, value);
				yield token(type, text, position, parseNumber(text), null);
			}
			case URL -> {
				String text = required(type, value);
				yield token(type, text, position, null, extractUrl(text));
			}
			case FUNCTION -> {
				String name = required(type, value);
				yield token(type, name, position, null, name);
			}
			default -> token(type, required(type, value), position, null, null);
		};
	}

	/**
	 * Convenience for the end-of-input token.
	 */
	public CssToken eof(TokenPosition position) {
		return create(CssTokenType.EOF, "", position);
	}

	private CssToken fixed(CssTokenType type, String text, TokenPosition position) {
		return token(type, text, position, null, null);
	}

	private CssToken token(CssTokenType type, String value, TokenPosition position, Double numeric, String detail) {
		return new CssToken(ids.nextId(), type, value, position, numeric, detail);
	}

	private static String required(CssTokenType type, String value) {
		if (value == null) {
			throw new MalformedTokenException("Token of type " + type + " requires a value");
		}
		return value;
	}

	private static void validatePosition(TokenPosition position) {
		if (position == null || !position.isValid()) {
			throw new MalformedTokenException(
					"Invalid position " + position + ". Must have line and column >= 1 and 0 <= start <= end");
		}
	}

	private static String stripPrefix(String value, String prefix) {
		return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
	}

	private static double parseNumber(String text) {
		try {
			return Double.parseDouble(text);
		} catch (NumberFormatException e) {
			logger.debug("Numeric token text '{}' is not a number; using 0", text);
			return 0;
		}
	}

	private static String extractUrl(String text) {
		Matcher matcher = URL_PATTERN.matcher(text);
		return matcher.matches() ? matcher.group(1) : text;
	}
}
