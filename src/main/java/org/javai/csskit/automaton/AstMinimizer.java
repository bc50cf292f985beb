package org.javai.csskit.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.javai.csskit.ast.CssAst;
import org.javai.csskit.ast.CssNode;
import org.javai.csskit.ast.CssNodeWalker;
import org.javai.csskit.ast.NodeMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes equivalence classes over stylesheet tree nodes.
 * <p>
 * Every node is a state whose transitions are its child edges. Children of
 * rule-like nodes are reached on one shared symbol, so their order does not
 * matter; other children are reached on positional symbols. Terminal kinds
 * (property, value, comment, selector) are the accepting states, and the
 * initial split also separates nodes by kind, value and kind-specific fields.
 * Two nodes end up in one class exactly when their subtrees are equivalent in
 * the sense of {@link CssNode#isEquivalentTo}.
 */
public class AstMinimizer {

	private static final Logger logger = LoggerFactory.getLogger(AstMinimizer.class);

	private final MinimizerOptions options;

	public AstMinimizer() {
		this(MinimizerOptions.defaults());
	}

	public AstMinimizer(MinimizerOptions options) {
		this.options = options != null ? options : MinimizerOptions.defaults();
	}

	/**
	 * Minimizes the whole tree and attaches the metrics to the AST.
	 *
	 * @param ast the tree; its nodes are stamped when the options ask for it
	 * @return the node partition and its metrics
	 */
	public MinimizationResult<CssNode> minimize(CssAst ast) {
		MinimizationResult<CssNode> result = minimize(List.of(ast.getRoot()));
		ast.attachMetrics(CssAst.NODE_METRICS, result.metrics());
		return result;
	}

	/**
	 * @param root the subtree to minimize
	 * @return the node partition and its metrics
	 */
	public MinimizationResult<CssNode> minimize(CssNode root) {
		return minimize(List.of(root));
	}

	/**
	 * Minimizes the given subtrees together. The universe is every node of every subtree.
	 *
	 * @param roots subtree roots; a node reachable from several roots counts once
	 * @return the node partition and its metrics
	 */
	public MinimizationResult<CssNode> minimize(Collection<CssNode> roots) {
		Set<CssNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		List<CssNode> universe = new ArrayList<>();
		for (CssNode root : roots) {
			for (CssNode node : CssNodeWalker.collect(root)) {
				if (seen.add(node)) {
					universe.add(node);
				}
			}
		}

		PartitionRefiner<CssNode> refiner = new PartitionRefiner<>(new NodeSubject(universe));
		Partition<CssNode> partition = refiner.refine();

		if (options.stampMetadata()) {
			for (int i = 0; i < partition.blockCount(); i++) {
				for (CssNode node : partition.members(i)) {
					NodeMetadata metadata = node.getMetadata();
					metadata.setEquivalenceClass(i);
					metadata.setStateSignature(node.computeSignature());
					metadata.setMinimized(true);
				}
			}
		}

		OptimizationMetrics metrics = OptimizationMetrics.of(universe.size(), partition.blockCount());
		logger.debug("Minimized {} nodes after {} passes: {}", universe.size(), refiner.iterations(), metrics);
		return new MinimizationResult<>(partition, metrics, refiner.iterations(), null);
	}

	private record NodeSubject(List<CssNode> universe) implements PartitionRefiner.Subject<CssNode> {

		@Override
		public String initialKey(CssNode node) {
			String value = node.getValue() != null ? node.getValue() : "";
			return (node.getKind().isTerminal() ? "0" : "1") + "|" + node.getKind() + "|" + value
					+ "|" + node.getData().signatureFields();
		}

		@Override
		public List<PartitionRefiner.Edge<CssNode>> edges(CssNode node) {
			List<CssNode> children = node.getChildren();
			List<PartitionRefiner.Edge<CssNode>> edges = new ArrayList<>(children.size());
			boolean unordered = node.getKind().hasUnorderedChildren();
			for (int i = 0; i < children.size(); i++) {
				String symbol = unordered ? "child" : "child[" + i + "]";
				edges.add(new PartitionRefiner.Edge<>(symbol, children.get(i)));
			}
			return edges;
		}
	}
}
