package org.javai.csskit.ast;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.javai.csskit.automaton.OptimizationMetrics;

/**
 * A parsed stylesheet: the STYLESHEET root plus the summary data attached by
 * optimization passes.
 */
public final class CssAst {

	/** Metrics of the minimized parser automaton. */
	public static final String STATE_METRICS = "states";
	/** Metrics of the node minimization. */
	public static final String NODE_METRICS = "nodes";

	private final CssNode root;
	private final Map<String, OptimizationMetrics> metrics = new LinkedHashMap<>();

	public CssAst(CssNode root) {
		if (root == null || !root.isKind(NodeKind.STYLESHEET)) {
			throw new IllegalArgumentException("AST root must be a STYLESHEET node");
		}
		this.root = root;
	}

	public static CssAst empty() {
		return new CssAst(CssNode.stylesheet());
	}

	public CssNode getRoot() {
		return root;
	}

	public void attachMetrics(String name, OptimizationMetrics value) {
		metrics.put(name, value);
	}

	public Optional<OptimizationMetrics> getMetrics(String name) {
		return Optional.ofNullable(metrics.get(name));
	}

	public Map<String, OptimizationMetrics> getAllMetrics() {
		return Map.copyOf(metrics);
	}

	public int nodeCount() {
		return root.subtreeSize();
	}

	public CssAst deepCopy() {
		CssAst copy = new CssAst(root.clone(true));
		copy.metrics.putAll(metrics);
		return copy;
	}

	@Override
	public String toString() {
		return CssSerializer.printCompact(root);
	}
}
