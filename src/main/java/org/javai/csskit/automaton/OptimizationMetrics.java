package org.javai.csskit.automaton;

import java.util.Locale;

/**
 * Size summary of one minimization run.
 *
 * @param originalCount states or nodes before minimization
 * @param minimizedCount equivalence classes after minimization
 * @param ratio {@code minimizedCount / originalCount}, 1.0 for an empty universe
 */
public record OptimizationMetrics(int originalCount, int minimizedCount, double ratio) {

	public static OptimizationMetrics of(int originalCount, int minimizedCount) {
		double ratio = originalCount == 0 ? 1.0 : (double) minimizedCount / originalCount;
		return new OptimizationMetrics(originalCount, minimizedCount, ratio);
	}

	public int saved() {
		return originalCount - minimizedCount;
	}

	@Override
	public String toString() {
		return String.format(Locale.ROOT, "%d -> %d (ratio %.3f)", originalCount, minimizedCount, ratio);
	}
}
