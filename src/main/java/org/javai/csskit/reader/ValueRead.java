package org.javai.csskit.reader;

import java.util.List;
import org.javai.csskit.token.CssToken;

/**
 * A declaration value.
 *
 * @param text the value as written, with single spaces where the source had gaps
 * @param parts the value tokens, excluding any {@code !important} flag
 * @param important whether the value carried {@code !important}
 */
public record ValueRead(String text, List<CssToken> parts, boolean important) {

	public ValueRead {
		parts = List.copyOf(parts);
	}
}
