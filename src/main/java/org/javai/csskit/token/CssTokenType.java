package org.javai.csskit.token;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed alphabet of stylesheet tokens.
 */
public enum CssTokenType {
	// structure
	START_BLOCK,         // {
	END_BLOCK,           // }
	SEMICOLON,           // ;
	COLON,               // :
	COMMA,               // ,
	OPEN_PAREN,          // (
	CLOSE_PAREN,         // )

	// selectors
	SELECTOR,            // *, &
	ELEMENT_SELECTOR,    // div, a
	CLASS_SELECTOR,      // .name
	ID_SELECTOR,         // #name
	ATTRIBUTE_SELECTOR,  // [attr=value]
	PSEUDO_CLASS,        // :hover
	PSEUDO_ELEMENT,      // ::before
	COMBINATOR,          // > + ~

	// declarations
	PROPERTY,
	VALUE,
	UNIT,                // px, em, %
	NUMBER,
	COLOR,               // #fff
	URL,                 // url(...)
	STRING,              // "text", 'text'
	FUNCTION,            // rgb, calc

	// special
	AT_KEYWORD,          // @media
	COMMENT,
	WHITESPACE,
	IMPORTANT_FLAG,      // !important
	EOF,
	ERROR;

	public boolean isStructural() {
		return switch (this) {
			case START_BLOCK, END_BLOCK, SEMICOLON, COLON, COMMA, OPEN_PAREN, CLOSE_PAREN -> true;
			default -> false;
		};
	}

	public boolean isSelector() {
		return switch (this) {
			case SELECTOR, ELEMENT_SELECTOR, CLASS_SELECTOR, ID_SELECTOR, ATTRIBUTE_SELECTOR,
				 PSEUDO_CLASS, PSEUDO_ELEMENT, COMBINATOR -> true;
			default -> false;
		};
	}

	public boolean isValue() {
		return switch (this) {
			case VALUE, UNIT, NUMBER, COLOR, URL, STRING, FUNCTION, IMPORTANT_FLAG -> true;
			default -> false;
		};
	}

	public boolean isWhitespaceOrComment() {
		return this == WHITESPACE || this == COMMENT;
	}

	/**
	 * Looks up a kind by its symbolic name. Accepts {@code CLASS_SELECTOR},
	 * {@code class-selector} and {@code ClassSelector} spellings.
	 */
	public static Optional<CssTokenType> fromName(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		String normalized = name.trim()
				.replaceAll("([a-z])([A-Z])", "$1_$2")
				.replace('-', '_')
				.toUpperCase(Locale.ROOT);
		for (CssTokenType type : values()) {
			if (type.name().equals(normalized)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
