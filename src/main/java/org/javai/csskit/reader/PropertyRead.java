package org.javai.csskit.reader;

import org.javai.csskit.token.CssToken;

/**
 * A property name and the colon that follows it.
 */
public record PropertyRead(String name, CssToken token) {
}
