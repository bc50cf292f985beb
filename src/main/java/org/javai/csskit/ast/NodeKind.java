package org.javai.csskit.ast;

/**
 * Kinds of stylesheet tree nodes.
 */
public enum NodeKind {
	STYLESHEET,
	RULE,
	AT_RULE,
	SELECTOR,
	DECLARATION,
	PROPERTY,
	VALUE,
	FUNCTION,
	COMMENT,
	KEYFRAME_BLOCK;

	/**
	 * Kinds whose children form a set rather than a sequence for equivalence
	 * purposes: reordering the contents of a rule or at-rule block does not
	 * change which declarations and nested rules it holds.
	 */
	public boolean hasUnorderedChildren() {
		return this == RULE || this == AT_RULE || this == KEYFRAME_BLOCK;
	}

	/**
	 * Leaf kinds that terminate a derivation; the accepting kinds for AST minimization.
	 */
	public boolean isTerminal() {
		return this == PROPERTY || this == VALUE || this == COMMENT || this == SELECTOR;
	}
}
