package org.javai.csskit.reader;

/**
 * An at-rule.
 *
 * @param name the keyword without {@code @}
 * @param prelude the text between the keyword and the block or semicolon
 * @param block the block contents, {@code null} for statement at-rules such as {@code @import}
 */
public record AtRuleRead(String name, String prelude, BlockRead block) {

	public boolean hasBlock() {
		return block != null;
	}
}
