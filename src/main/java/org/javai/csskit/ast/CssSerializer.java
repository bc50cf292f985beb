package org.javai.csskit.ast;

import java.util.List;

/**
 * Visitor that writes a stylesheet tree back out as stylesheet text, either
 * indented or compact.
 */
public class CssSerializer implements CssNodeVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private int indentLevel = 0;
	private final boolean pretty;
	private final int indentSize;

	public CssSerializer() {
		this(true, 2);
	}

	public CssSerializer(boolean pretty, int indentSize) {
		this.pretty = pretty;
		this.indentSize = indentSize;
	}

	@Override
	public Void visitNode(CssNode node) {
		String value = node.getValue();
		output.append(value != null ? value : "");
		return null;
	}

	@Override
	public Void visitStylesheet(CssNode node) {
		List<CssNode> children = node.getChildren();
		for (int i = 0; i < children.size(); i++) {
			if (i > 0 && pretty) {
				output.append('\n');
			}
			indent();
			children.get(i).accept(this);
		}
		return null;
	}

	@Override
	public Void visitRule(CssNode node) {
		output.append(node.getSelector());
		block(node.getChildren());
		return null;
	}

	@Override
	public Void visitKeyframeBlock(CssNode node) {
		return visitRule(node);
	}

	@Override
	public Void visitAtRule(CssNode node) {
		NodeData.AtRule atRule = (NodeData.AtRule) node.getData();
		output.append('@').append(atRule.name());
		if (atRule.prelude() != null && !atRule.prelude().isEmpty()) {
			output.append(' ').append(atRule.prelude());
		}
		if (atRule.hasBlock()) {
			block(node.getChildren());
		} else {
			output.append(';');
		}
		return null;
	}

	@Override
	public Void visitDeclaration(CssNode node) {
		output.append(node.getPropertyName()).append(pretty ? ": " : ":").append(node.getValueText());
		if (node.isImportant()) {
			output.append(pretty ? " !important" : "!important");
		}
		return null;
	}

	@Override
	public Void visitFunction(CssNode node) {
		output.append(node.getValue()).append('(').append(node.getValueText()).append(')');
		return null;
	}

	@Override
	public Void visitComment(CssNode node) {
		output.append("/* ").append(node.getValue()).append(" */");
		return null;
	}

	private void block(List<CssNode> children) {
		output.append(pretty ? " {" : "{");
		indentLevel++;
		for (int i = 0; i < children.size(); i++) {
			CssNode child = children.get(i);
			if (pretty) {
				output.append('\n');
				indent();
			}
			child.accept(this);
			if (child.isKind(NodeKind.DECLARATION) && (pretty || i < children.size() - 1)) {
				output.append(';');
			}
		}
		indentLevel--;
		if (pretty) {
			output.append('\n');
			indent();
		}
		output.append('}');
		if (pretty && indentLevel == 0) {
			output.append('\n');
		}
	}

	private void indent() {
		if (pretty) {
			output.append(" ".repeat(indentLevel * indentSize));
		}
	}

	/**
	 * Returns the serialized output.
	 */
	public String toString() {
		return output.toString();
	}

	/**
	 * Serializes a tree in indented form.
	 */
	public static String print(CssNode node) {
		CssSerializer serializer = new CssSerializer();
		node.accept(serializer);
		return serializer.toString();
	}

	/**
	 * Serializes a tree without optional whitespace.
	 */
	public static String printCompact(CssNode node) {
		CssSerializer serializer = new CssSerializer(false, 0);
		node.accept(serializer);
		return serializer.toString();
	}
}
