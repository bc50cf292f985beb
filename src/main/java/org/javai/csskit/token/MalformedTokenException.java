package org.javai.csskit.token;

import org.javai.csskit.CssKitException;

/**
 * Thrown by {@link CssTokenBuilder} when asked to build a token with an
 * unknown kind, a missing value or an invalid position.
 */
public class MalformedTokenException extends CssKitException {

	public MalformedTokenException(String message) {
		super(message);
	}
}
