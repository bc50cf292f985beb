package org.javai.csskit.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CssNodeTest {

	@Test
	void addChildSetsParent() {
		CssNode rule = CssNode.rule("a");
		CssNode declaration = CssNode.declaration("color", false, "red");

		assertThat(rule.addChild(declaration)).isTrue();

		assertThat(declaration.getParent()).isSameAs(rule);
		assertThat(rule.getChildren()).containsExactly(declaration);
	}

	@Test
	void addChildMovesNodeFromPreviousParent() {
		CssNode first = CssNode.rule("a");
		CssNode second = CssNode.rule("b");
		CssNode declaration = CssNode.declaration("color", false, "red");
		first.addChild(declaration);

		second.addChild(declaration);

		assertThat(first.getChildren()).isEmpty();
		assertThat(second.getChildren()).containsExactly(declaration);
		assertThat(declaration.getParent()).isSameAs(second);
	}

	@Test
	void addChildRejectsNull() {
		assertThatThrownBy(() -> CssNode.rule("a").addChild(null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Child node cannot be null");
	}

	@Test
	void addChildRejectsCycles() {
		CssNode outer = CssNode.atRule("media", "print", true);
		CssNode inner = CssNode.rule("a");
		outer.addChild(inner);

		assertThatThrownBy(() -> inner.addChild(outer))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("cycle");
		assertThatThrownBy(() -> inner.addChild(inner))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void removeChildClearsParent() {
		CssNode rule = CssNode.rule("a");
		CssNode declaration = CssNode.declaration("color", false, "red");
		rule.addChild(declaration);

		assertThat(rule.removeChild(declaration)).isTrue();

		assertThat(declaration.getParent()).isNull();
		assertThat(rule.getChildren()).isEmpty();
		assertThat(rule.removeChild(declaration)).isFalse();
	}

	@Test
	void replaceChildKeepsSlot() {
		CssNode rule = CssNode.rule("a");
		CssNode color = CssNode.declaration("color", false, "red");
		CssNode margin = CssNode.declaration("margin", false, "0");
		CssNode padding = CssNode.declaration("padding", false, "1px");
		rule.addChild(color);
		rule.addChild(margin);

		assertThat(rule.replaceChild(color, padding)).isTrue();

		assertThat(rule.getChildren()).containsExactly(padding, margin);
		assertThat(color.getParent()).isNull();
		assertThat(padding.getParent()).isSameAs(rule);
		assertThat(rule.replaceChild(color, padding)).isFalse();
	}

	@Test
	void childrenListIsReadOnly() {
		CssNode rule = CssNode.rule("a");

		assertThatThrownBy(() -> rule.getChildren().add(CssNode.value("x")))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void findChildAndFindChildren() {
		CssNode declaration = CssNode.declaration("margin", false, "0", "auto");

		assertThat(declaration.findChild(NodeKind.PROPERTY)).map(CssNode::getValue).contains("margin");
		assertThat(declaration.findChildren(NodeKind.VALUE)).extracting(CssNode::getValue).containsExactly("0", "auto");
		assertThat(declaration.findChild(NodeKind.FUNCTION)).isEmpty();
	}

	@Test
	void derivedGetters() {
		CssNode declaration = CssNode.declaration("font-family", true, "Arial", ",", "sans-serif");

		assertThat(declaration.getPropertyName()).isEqualTo("font-family");
		assertThat(declaration.isImportant()).isTrue();
		assertThat(declaration.getValueText()).isEqualTo("Arial, sans-serif");
		assertThat(CssNode.rule(".x").getSelector()).isEqualTo(".x");
		assertThat(CssNode.keyframeBlock("50%").getSelector()).isEqualTo("50%");
		assertThat(CssNode.value("x").getSelector()).isNull();
	}

	@Test
	void valueTextRendersFunctions() {
		CssNode declaration = CssNode.declaration("color", false);
		declaration.addChild(CssNode.property("color"));
		CssNode rgb = CssNode.function("rgb");
		rgb.addChild(CssNode.value("1"));
		rgb.addChild(CssNode.value(","));
		rgb.addChild(CssNode.value("2"));
		declaration.addChild(rgb);

		assertThat(declaration.getValueText()).isEqualTo("rgb(1, 2)");
	}

	@Test
	void sizeAndDepth() {
		CssNode root = CssNode.stylesheet();
		CssNode rule = CssNode.rule("a");
		CssNode declaration = CssNode.declaration("color", false, "red");
		root.addChild(rule);
		rule.addChild(declaration);

		assertThat(root.subtreeSize()).isEqualTo(5);
		assertThat(declaration.depth()).isEqualTo(2);
		assertThat(root.depth()).isZero();
	}

	@Test
	void deepCloneIsEquivalentButDetached() {
		CssNode root = CssNode.stylesheet();
		CssNode rule = CssNode.rule("a");
		rule.addChild(CssNode.declaration("color", false, "red"));
		root.addChild(rule);
		rule.getMetadata().setEquivalenceClass(4);

		CssNode copy = rule.clone(true);

		assertThat(copy).isNotSameAs(rule);
		assertThat(copy.getParent()).isNull();
		assertThat(copy.isEquivalentTo(rule)).isTrue();
		assertThat(copy.getChildren().get(0)).isNotSameAs(rule.getChildren().get(0));
		assertThat(copy.getChildren().get(0).getParent()).isSameAs(copy);
		assertThat(copy.getMetadata().getEquivalenceClass()).isEqualTo(4);
		assertThat(copy.getMetadata()).isNotSameAs(rule.getMetadata());
	}

	@Test
	void shallowCloneHasNoChildren() {
		CssNode rule = CssNode.rule("a");
		rule.addChild(CssNode.declaration("color", false, "red"));

		CssNode copy = rule.clone(false);

		assertThat(copy.getChildren()).isEmpty();
		assertThat(copy.getSelector()).isEqualTo("a");
	}

	@Test
	void ruleChildrenAreComparedAsASet() {
		CssNode first = CssNode.rule("a");
		first.addChild(CssNode.declaration("color", false, "red"));
		first.addChild(CssNode.declaration("margin", false, "0"));
		CssNode second = CssNode.rule("a");
		second.addChild(CssNode.declaration("margin", false, "0"));
		second.addChild(CssNode.declaration("color", false, "red"));

		assertThat(first.isEquivalentTo(second)).isTrue();
		assertThat(first.computeSignature()).isEqualTo(second.computeSignature());
	}

	@Test
	void valuesAreComparedInOrder() {
		CssNode first = CssNode.declaration("margin", false, "0", "auto");
		CssNode second = CssNode.declaration("margin", false, "auto", "0");

		assertThat(first.isEquivalentTo(second)).isFalse();
		assertThat(first.computeSignature()).isNotEqualTo(second.computeSignature());
	}

	@Test
	void equivalenceLooksAtKindSpecificFields() {
		assertThat(CssNode.declaration("color", true, "red").isEquivalentTo(CssNode.declaration("color", false, "red")))
				.isFalse();
		assertThat(CssNode.rule("a").isEquivalentTo(CssNode.rule("b"))).isFalse();
		assertThat(CssNode.rule("a").isEquivalentTo(null)).isFalse();
	}

	@Test
	void signatureFormat() {
		CssNode declaration = CssNode.declaration("color", false, "red");

		assertThat(declaration.computeSignature()).isEqualTo("DECLARATION||important=false|PROPERTY:color,VALUE:red");
	}

	@Test
	void visitorDispatchesOnKind() {
		List<String> visited = new ArrayList<>();
		CssNodeVisitor<Void> visitor = new CssNodeVisitor<>() {
			@Override
			public Void visitNode(CssNode node) {
				visited.add("node:" + node.getKind());
				return null;
			}

			@Override
			public Void visitDeclaration(CssNode node) {
				visited.add("declaration:" + node.getPropertyName());
				return null;
			}
		};

		CssNodeWalker.walkPreOrder(CssNode.declaration("color", false, "red"), visitor);

		assertThat(visited).containsExactly("declaration:color", "node:PROPERTY", "node:VALUE");
	}

	@Test
	void walkersVisitInPreAndPostOrder() {
		CssNode root = CssNode.stylesheet();
		CssNode rule = CssNode.rule("a");
		root.addChild(rule);
		rule.addChild(CssNode.declaration("color", false, "red"));

		List<NodeKind> pre = new ArrayList<>();
		List<NodeKind> post = new ArrayList<>();
		CssNodeWalker.walkPreOrder(root, node -> pre.add(node.getKind()));
		CssNodeWalker.walkPostOrder(root, node -> post.add(node.getKind()));

		assertThat(pre).containsExactly(NodeKind.STYLESHEET, NodeKind.RULE, NodeKind.DECLARATION, NodeKind.PROPERTY,
				NodeKind.VALUE);
		assertThat(post).containsExactly(NodeKind.PROPERTY, NodeKind.VALUE, NodeKind.DECLARATION, NodeKind.RULE,
				NodeKind.STYLESHEET);
		assertThat(CssNodeWalker.collect(root, NodeKind.VALUE)).hasSize(1);
	}

	@Test
	void postOrderWalkToleratesDetachingChildren() {
		CssNode rule = CssNode.rule("a");
		rule.addChild(CssNode.comment("x"));
		rule.addChild(CssNode.declaration("color", false, "red"));

		CssNodeWalker.walkPostOrder(rule, node -> node.isKind(NodeKind.COMMENT) && rule.removeChild(node));

		assertThat(rule.getChildren()).extracting(CssNode::getKind).containsExactly(NodeKind.DECLARATION);
	}

	@Test
	void metadataStartsEmpty() {
		NodeMetadata metadata = CssNode.value("x").getMetadata();

		assertThat(metadata.getEquivalenceClass()).isNull();
		assertThat(metadata.isMinimized()).isFalse();

		metadata.setEquivalenceClass(1);
		metadata.custom().put("origin", "test");
		metadata.clear();

		assertThat(metadata.getEquivalenceClass()).isNull();
		assertThat(metadata.custom()).isEmpty();
	}
}
