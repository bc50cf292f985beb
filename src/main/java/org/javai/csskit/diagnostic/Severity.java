package org.javai.csskit.diagnostic;

/**
 * Severity of a reported diagnostic.
 */
public enum Severity {
	WARNING,
	ERROR
}
