package org.javai.csskit.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A mutable node of a stylesheet tree.
 * <p>
 * A node owns its children. The parent link is a plain back-reference kept
 * consistent by {@link #addChild}, {@link #removeChild} and
 * {@link #replaceChild}: a node appears in exactly one parent's child list
 * and its parent link names that parent. Detaching a node clears the link.
 */
public final class CssNode {

	private final NodeKind kind;
	private String value;
	private NodeData data;
	private final List<CssNode> children = new ArrayList<>();
	private CssNode parent;
	private NodeMetadata metadata = new NodeMetadata();

	public CssNode(NodeKind kind, String value, NodeData data) {
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.value = value;
		this.data = data != null ? data : NodeData.Plain.INSTANCE;
	}

	public static CssNode stylesheet() {
		return new CssNode(NodeKind.STYLESHEET, null, null);
	}

	public static CssNode rule(String selector) {
		return new CssNode(NodeKind.RULE, null, new NodeData.Rule(selector));
	}

	public static CssNode atRule(String name, String prelude, boolean hasBlock) {
		return new CssNode(NodeKind.AT_RULE, null, new NodeData.AtRule(name, prelude, hasBlock));
	}

	public static CssNode selector(String text) {
		return new CssNode(NodeKind.SELECTOR, text, null);
	}

	public static CssNode declaration(boolean important) {
		return new CssNode(NodeKind.DECLARATION, null, new NodeData.Declaration(important));
	}

	/**
	 * A declaration with a property child and one value child per value.
	 */
	public static CssNode declaration(String property, boolean important, String... values) {
		CssNode declaration = declaration(important);
		declaration.addChild(property(property));
		for (String v : values) {
			declaration.addChild(value(v));
		}
		return declaration;
	}

	public static CssNode property(String name) {
		return new CssNode(NodeKind.PROPERTY, name, null);
	}

	public static CssNode value(String value) {
		return new CssNode(NodeKind.VALUE, value, null);
	}

	public static CssNode function(String name) {
		return new CssNode(NodeKind.FUNCTION, name, null);
	}

	public static CssNode comment(String text) {
		return new CssNode(NodeKind.COMMENT, text, null);
	}

	public static CssNode keyframeBlock(String keyText) {
		return new CssNode(NodeKind.KEYFRAME_BLOCK, null, new NodeData.KeyframeBlock(keyText));
	}

	// ---- accessors ----

	public NodeKind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	public NodeData getData() {
		return data;
	}

	public void setData(NodeData data) {
		this.data = data != null ? data : NodeData.Plain.INSTANCE;
	}

	public List<CssNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public CssNode getParent() {
		return parent;
	}

	public NodeMetadata getMetadata() {
		return metadata;
	}

	public boolean isKind(NodeKind expected) {
		return kind == expected;
	}

	/**
	 * The selector text of a RULE, the key text of a KEYFRAME_BLOCK, {@code null} otherwise.
	 */
	public String getSelector() {
		if (data instanceof NodeData.Rule rule) {
			return rule.selector();
		}
		if (data instanceof NodeData.KeyframeBlock keyframe) {
			return keyframe.keyText();
		}
		return null;
	}

	public boolean isImportant() {
		return data instanceof NodeData.Declaration declaration && declaration.important();
	}

	/**
	 * The property name of a DECLARATION, {@code null} if it has no property child.
	 */
	public String getPropertyName() {
		return findChild(NodeKind.PROPERTY).map(CssNode::getValue).orElse(null);
	}

	/**
	 * The values of a DECLARATION or the arguments of a FUNCTION as written,
	 * separated by single spaces.
	 */
	public String getValueText() {
		StringBuilder sb = new StringBuilder();
		for (CssNode child : children) {
			if (child.kind == NodeKind.PROPERTY) {
				continue;
			}
			String text = child.kind == NodeKind.FUNCTION ? child.getFunctionText() : child.value;
			if (sb.length() > 0 && !",".equals(text)) {
				sb.append(' ');
			}
			sb.append(text);
		}
		return sb.toString();
	}

	private String getFunctionText() {
		return value + "(" + getValueText() + ")";
	}

	// ---- tree mutation ----

	/**
	 * Appends a child, detaching it from its current parent first.
	 *
	 * @return {@code true} once the child is attached
	 * @throws IllegalArgumentException if the child is null or attaching it would create a cycle
	 */
	public boolean addChild(CssNode child) {
		checkAttachable(child);
		if (child.parent != null) {
			child.parent.removeChild(child);
		}
		children.add(child);
		child.parent = this;
		return true;
	}

	/**
	 * Removes a child.
	 *
	 * @return {@code false} if the node is not a child of this node
	 */
	public boolean removeChild(CssNode child) {
		int index = indexOf(child);
		if (index < 0) {
			return false;
		}
		children.remove(index);
		child.parent = null;
		return true;
	}

	/**
	 * Puts {@code replacement} in the slot of {@code existing}. The replacement is
	 * detached from its current parent first; the replaced node is detached.
	 *
	 * @return {@code false} if {@code existing} is not a child of this node
	 * @throws IllegalArgumentException if attaching the replacement would create a cycle
	 */
	public boolean replaceChild(CssNode existing, CssNode replacement) {
		if (indexOf(existing) < 0) {
			return false;
		}
		if (existing == replacement) {
			return true;
		}
		checkAttachable(replacement);
		if (replacement.parent != null) {
			replacement.parent.removeChild(replacement);
		}
		int index = indexOf(existing);
		children.set(index, replacement);
		existing.parent = null;
		replacement.parent = this;
		return true;
	}

	public int indexOf(CssNode child) {
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		return -1;
	}

	private void checkAttachable(CssNode child) {
		if (child == null) {
			throw new IllegalArgumentException("Child node cannot be null");
		}
		for (CssNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
			if (ancestor == child) {
				throw new IllegalArgumentException("Adding " + child.kind + " under " + kind + " would create a cycle");
			}
		}
	}

	// ---- queries ----

	public Optional<CssNode> findChild(NodeKind childKind) {
		return children.stream().filter(child -> child.kind == childKind).findFirst();
	}

	public List<CssNode> findChildren(NodeKind childKind) {
		return children.stream().filter(child -> child.kind == childKind).toList();
	}

	/**
	 * Number of nodes in the subtree rooted here, this node included.
	 */
	public int subtreeSize() {
		int size = 1;
		for (CssNode child : children) {
			size += child.subtreeSize();
		}
		return size;
	}

	public int depth() {
		int depth = 0;
		for (CssNode ancestor = parent; ancestor != null; ancestor = ancestor.parent) {
			depth++;
		}
		return depth;
	}

	// ---- copying and comparison ----

	/**
	 * Copies this node. A deep clone duplicates the whole subtree with its
	 * metadata; a shallow clone duplicates only this node. The copy is detached.
	 */
	public CssNode clone(boolean deep) {
		CssNode copy = new CssNode(kind, value, data);
		copy.metadata = metadata.copy();
		if (deep) {
			for (CssNode child : children) {
				copy.addChild(child.clone(true));
			}
		}
		return copy;
	}

	/**
	 * One-level fingerprint: kind, value, kind-specific fields and the
	 * kind:value pairs of the immediate children. Children of rule-like
	 * nodes are listed in sorted order.
	 */
	public String computeSignature() {
		List<String> childPairs = new ArrayList<>(children.size());
		for (CssNode child : children) {
			childPairs.add(child.kind + ":" + nullToEmpty(child.value));
		}
		if (kind.hasUnorderedChildren()) {
			Collections.sort(childPairs);
		}
		return kind + "|" + nullToEmpty(value) + "|" + data.signatureFields() + "|" + String.join(",", childPairs);
	}

	/**
	 * Structural equality. Children of RULE, AT_RULE and KEYFRAME_BLOCK nodes are
	 * compared as a multiset by greedy one-to-one matching; other children in order.
	 */
	public boolean isEquivalentTo(CssNode other) {
		if (other == null) {
			return false;
		}
		if (other == this) {
			return true;
		}
		if (kind != other.kind || !Objects.equals(value, other.value) || !data.equals(other.data)
				|| children.size() != other.children.size()) {
			return false;
		}
		if (kind.hasUnorderedChildren()) {
			boolean[] matched = new boolean[other.children.size()];
			for (CssNode child : children) {
				boolean found = false;
				for (int i = 0; i < matched.length; i++) {
					if (!matched[i] && child.isEquivalentTo(other.children.get(i))) {
						matched[i] = true;
						found = true;
						break;
					}
				}
				if (!found) {
					return false;
				}
			}
			return true;
		}
		for (int i = 0; i < children.size(); i++) {
			if (!children.get(i).isEquivalentTo(other.children.get(i))) {
				return false;
			}
		}
		return true;
	}

	public <R> R accept(CssNodeVisitor<R> visitor) {
		return switch (kind) {
			case STYLESHEET -> visitor.visitStylesheet(this);
			case RULE -> visitor.visitRule(this);
			case AT_RULE -> visitor.visitAtRule(this);
			case SELECTOR -> visitor.visitSelector(this);
			case DECLARATION -> visitor.visitDeclaration(this);
			case PROPERTY -> visitor.visitProperty(this);
			case VALUE -> visitor.visitValue(this);
			case FUNCTION -> visitor.visitFunction(this);
			case COMMENT -> visitor.visitComment(this);
			case KEYFRAME_BLOCK -> visitor.visitKeyframeBlock(this);
		};
	}

	private static String nullToEmpty(String s) {
		return s != null ? s : "";
	}

	@Override
	public String toString() {
		String fields = data.signatureFields();
		return kind
				+ (value != null ? "(" + value + ")" : "")
				+ (fields.isEmpty() ? "" : "{" + fields + "}")
				+ (children.isEmpty() ? "" : "[" + children.size() + " children]");
	}
}
