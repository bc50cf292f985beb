package org.javai.csskit.token;

/**
 * Source position of a token.
 *
 * @param line 1-based line
 * @param column 1-based column
 * @param start offset of the first character
 * @param end offset one past the last character
 */
public record TokenPosition(int line, int column, int start, int end) {

	/**
	 * A position whose offsets are derived from the column, for callers
	 * that only know line and column.
	 */
	public static TokenPosition at(int line, int column) {
		return new TokenPosition(line, column, column - 1, column - 1);
	}

	public int length() {
		return end - start;
	}

	public boolean isValid() {
		return line >= 1 && column >= 1 && start >= 0 && end >= start;
	}
}
