package org.javai.csskit.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Traversal helpers for stylesheet trees.
 */
public final class CssNodeWalker {

	private CssNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits a node before its children.
	 *
	 * @return the result of visiting the root node
	 */
	public static <R> R walkPreOrder(CssNode node, CssNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}
		R result = node.accept(visitor);
		for (CssNode child : List.copyOf(node.getChildren())) {
			walkPreOrder(child, visitor);
		}
		return result;
	}

	/**
	 * Visits children before their node. Children may be detached by the
	 * visitor while the walk is in progress.
	 *
	 * @return the result of visiting the root node
	 */
	public static <R> R walkPostOrder(CssNode node, CssNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}
		for (CssNode child : List.copyOf(node.getChildren())) {
			walkPostOrder(child, visitor);
		}
		return node.accept(visitor);
	}

	/**
	 * All nodes of the subtree in pre-order, the root first.
	 */
	public static List<CssNode> collect(CssNode root) {
		List<CssNode> nodes = new ArrayList<>();
		walkPreOrder(root, node -> nodes.add(node));
		return nodes;
	}

	/**
	 * Nodes of the given kind in pre-order.
	 */
	public static List<CssNode> collect(CssNode root, NodeKind kind) {
		return collect(root).stream().filter(node -> node.isKind(kind)).toList();
	}
}
