package org.javai.csskit.ast;

/**
 * Visitor over stylesheet trees, one method per node kind.
 * <p>
 * Every kind-specific method defaults to {@link #visitNode(CssNode)}, so a
 * visitor that treats all kinds alike only implements that one method.
 *
 * @param <R> the return type of the visitor operations
 */
public interface CssNodeVisitor<R> {

	/**
	 * Fallback for kinds the visitor does not handle specifically.
	 */
	R visitNode(CssNode node);

	default R visitStylesheet(CssNode node) {
		return visitNode(node);
	}

	default R visitRule(CssNode node) {
		return visitNode(node);
	}

	default R visitAtRule(CssNode node) {
		return visitNode(node);
	}

	default R visitSelector(CssNode node) {
		return visitNode(node);
	}

	default R visitDeclaration(CssNode node) {
		return visitNode(node);
	}

	default R visitProperty(CssNode node) {
		return visitNode(node);
	}

	default R visitValue(CssNode node) {
		return visitNode(node);
	}

	default R visitFunction(CssNode node) {
		return visitNode(node);
	}

	default R visitComment(CssNode node) {
		return visitNode(node);
	}

	default R visitKeyframeBlock(CssNode node) {
		return visitNode(node);
	}
}
