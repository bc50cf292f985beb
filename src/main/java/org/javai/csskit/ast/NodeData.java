package org.javai.csskit.ast;

/**
 * Kind-specific fields of a {@link CssNode}. Sealed so that every shape is known.
 */
public sealed interface NodeData {

	/**
	 * Fields contributed to a node signature, in a fixed order.
	 */
	String signatureFields();

	/**
	 * Nodes with no kind-specific fields.
	 */
	record Plain() implements NodeData {

		static final Plain INSTANCE = new Plain();

		@Override
		public String signatureFields() {
			return "";
		}
	}

	/**
	 * @param selector the selector text of the rule
	 */
	record Rule(String selector) implements NodeData {

		@Override
		public String signatureFields() {
			return "selector=" + selector;
		}
	}

	/**
	 * @param name the keyword without {@code @}
	 * @param prelude the text between the keyword and the block or semicolon
	 * @param hasBlock whether the at-rule owns a block
	 */
	record AtRule(String name, String prelude, boolean hasBlock) implements NodeData {

		@Override
		public String signatureFields() {
			return "name=" + name + ",prelude=" + prelude + ",block=" + hasBlock;
		}
	}

	/**
	 * @param important whether the declaration carried {@code !important}
	 */
	record Declaration(boolean important) implements NodeData {

		@Override
		public String signatureFields() {
			return "important=" + important;
		}
	}

	/**
	 * @param keyText the keyframe selector, such as {@code from} or {@code 50%}
	 */
	record KeyframeBlock(String keyText) implements NodeData {

		@Override
		public String signatureFields() {
			return "key=" + keyText;
		}
	}
}
