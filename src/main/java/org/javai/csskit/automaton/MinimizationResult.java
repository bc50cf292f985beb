package org.javai.csskit.automaton;

/**
 * Outcome of a minimization run.
 *
 * @param partition the final equivalence classes
 * @param metrics original and minimized counts
 * @param iterations refinement passes until the fixed point, the final unchanged pass included
 * @param quotient the minimized automaton, {@code null} when nodes rather than states were minimized
 * @param <T> the kind of element partitioned
 */
public record MinimizationResult<T>(Partition<T> partition, OptimizationMetrics metrics, int iterations, Automaton quotient) {

	public boolean hasQuotient() {
		return quotient != null;
	}

	public int classOf(T element) {
		return partition.blockOf(element);
	}
}
