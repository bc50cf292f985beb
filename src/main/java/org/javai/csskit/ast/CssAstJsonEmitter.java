package org.javai.csskit.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.csskit.CssKitException;
import org.javai.csskit.automaton.OptimizationMetrics;

/**
 * Emits a stylesheet tree as a JSON document for tooling and debugging.
 * Each node becomes an object with its kind, value, kind-specific fields,
 * minimization metadata and children.
 */
public final class CssAstJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private CssAstJsonEmitter() {}

	public static ObjectNode emit(CssAst ast) {
		ObjectNode root = mapper.createObjectNode();
		root.set("root", emit(ast.getRoot()));
		ObjectNode metrics = root.putObject("metrics");
		ast.getAllMetrics().forEach((name, m) -> metrics.set(name, emit(m)));
		return root;
	}

	public static ObjectNode emit(CssNode node) {
		ObjectNode json = mapper.createObjectNode();
		json.put("kind", node.getKind().name().toLowerCase());
		if (node.getValue() != null) {
			json.put("value", node.getValue());
		}

		NodeData data = node.getData();
		if (data instanceof NodeData.Rule rule) {
			json.put("selector", rule.selector());
		} else if (data instanceof NodeData.AtRule atRule) {
			json.put("name", atRule.name());
			json.put("prelude", atRule.prelude());
			json.put("hasBlock", atRule.hasBlock());
		} else if (data instanceof NodeData.Declaration declaration) {
			json.put("important", declaration.important());
		} else if (data instanceof NodeData.KeyframeBlock keyframe) {
			json.put("keyText", keyframe.keyText());
		}

		NodeMetadata metadata = node.getMetadata();
		if (metadata.getEquivalenceClass() != null) {
			json.put("equivalenceClass", metadata.getEquivalenceClass());
		}

		if (!node.getChildren().isEmpty()) {
			ArrayNode children = json.putArray("children");
			node.getChildren().forEach(child -> children.add(emit(child)));
		}
		return json;
	}

	public static ObjectNode emit(OptimizationMetrics metrics) {
		ObjectNode json = mapper.createObjectNode();
		json.put("originalCount", metrics.originalCount());
		json.put("minimizedCount", metrics.minimizedCount());
		json.put("optimizationRatio", metrics.ratio());
		return json;
	}

	public static String toJson(CssAst ast) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(emit(ast));
		} catch (JsonProcessingException e) {
			throw new CssKitException("Failed to write AST as JSON", e);
		}
	}
}
