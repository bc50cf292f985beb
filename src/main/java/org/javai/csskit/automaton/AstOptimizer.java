package org.javai.csskit.automaton;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.javai.csskit.ast.CssAst;
import org.javai.csskit.ast.CssNode;
import org.javai.csskit.ast.CssNodeWalker;
import org.javai.csskit.ast.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes redundant declarations from a stylesheet tree.
 * <p>
 * Within one block, a declaration equivalent to a later declaration of the
 * same block is removed: the later one wins anyway, so the rendered styles do
 * not change. Equivalence is read from the classes computed by
 * {@link AstMinimizer}.
 */
public class AstOptimizer {

	private static final Logger logger = LoggerFactory.getLogger(AstOptimizer.class);

	/** Metrics key for the node counts before and after deduplication. */
	public static final String DEDUPLICATION_METRICS = "deduplication";

	private final AstMinimizer minimizer;

	public AstOptimizer() {
		this(new AstMinimizer());
	}

	public AstOptimizer(AstMinimizer minimizer) {
		this.minimizer = minimizer;
	}

	/**
	 * Deduplicates declarations in place.
	 *
	 * @return node counts before and after; also attached to the AST
	 */
	public OptimizationMetrics optimize(CssAst ast) {
		int before = ast.nodeCount();
		MinimizationResult<CssNode> result = minimizer.minimize(ast.getRoot());

		int removed = 0;
		for (CssNode block : CssNodeWalker.collect(ast.getRoot())) {
			if (!isBlock(block)) {
				continue;
			}
			Set<Integer> laterClasses = new HashSet<>();
			List<CssNode> children = new ArrayList<>(block.getChildren());
			for (int i = children.size() - 1; i >= 0; i--) {
				CssNode child = children.get(i);
				if (!child.isKind(NodeKind.DECLARATION)) {
					continue;
				}
				if (!laterClasses.add(result.classOf(child))) {
					block.removeChild(child);
					removed++;
				}
			}
		}

		OptimizationMetrics metrics = OptimizationMetrics.of(before, ast.nodeCount());
		ast.attachMetrics(DEDUPLICATION_METRICS, metrics);
		logger.debug("Removed {} duplicate declarations: {}", removed, metrics);
		return metrics;
	}

	private static boolean isBlock(CssNode node) {
		return node.isKind(NodeKind.RULE) || node.isKind(NodeKind.AT_RULE) || node.isKind(NodeKind.KEYFRAME_BLOCK);
	}
}
