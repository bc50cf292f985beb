package org.javai.csskit.reader;

import java.util.List;
import org.javai.csskit.token.CssToken;

/**
 * A selector run such as {@code .x, .y > a}.
 *
 * @param text the part values joined with single spaces
 * @param parts the selector, combinator and comma tokens in source order
 */
public record SelectorRead(String text, List<CssToken> parts) {

	public SelectorRead {
		parts = List.copyOf(parts);
	}
}
