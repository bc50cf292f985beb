package org.javai.csskit.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partition refinement to the coarsest stable partition.
 * <p>
 * The universe is first split by each element's initial key. Each pass then
 * recomputes, for every member of a multi-member block, the sorted list of
 * {@code symbol->targetBlock} pairs against the current partition and splits
 * the block by that signature. Blocks only ever split, so the loop reaches a
 * fixed point after at most as many passes as there are elements.
 *
 * @param <T> element type; elements are compared by identity
 */
public final class PartitionRefiner<T> {

	private static final Logger logger = LoggerFactory.getLogger(PartitionRefiner.class);

	/**
	 * What is being refined: the elements, how they are split initially and
	 * the labelled edges leaving each element.
	 */
	public interface Subject<T> {

		Collection<T> universe();

		/**
		 * Initial block key. Blocks are ordered by key, so a subject that wants
		 * accepting elements first gives them the smaller key.
		 */
		String initialKey(T element);

		List<Edge<T>> edges(T element);
	}

	/**
	 * A labelled edge. Several edges of one element may share a symbol; the
	 * signature then treats them as a multiset.
	 */
	public record Edge<T>(String symbol, T target) {
	}

	private final Subject<T> subject;
	private int iterations;

	public PartitionRefiner(Subject<T> subject) {
		if (subject == null) {
			throw new IllegalArgumentException("Refinement subject cannot be null");
		}
		this.subject = subject;
	}

	/**
	 * Runs refinement to the fixed point.
	 *
	 * @return the coarsest partition in which every block is stable
	 * @throws IllegalStateException if an edge targets an element outside the universe
	 */
	public Partition<T> refine() {
		List<Set<T>> blocks = initialBlocks();
		iterations = 0;
		boolean split = true;
		while (split) {
			iterations++;
			split = false;
			Map<T, Integer> index = indexOf(blocks);
			List<Set<T>> next = new ArrayList<>(blocks.size());
			for (Set<T> block : blocks) {
				if (block.size() == 1) {
					next.add(block);
					continue;
				}
				Map<String, Set<T>> bySignature = new LinkedHashMap<>();
				for (T member : block) {
					bySignature.computeIfAbsent(signature(member, index), k -> new LinkedHashSet<>()).add(member);
				}
				if (bySignature.size() > 1) {
					split = true;
				}
				next.addAll(bySignature.values());
			}
			blocks = next;
		}
		logger.debug("Partition refinement reached a fixed point after {} passes: {} elements in {} blocks",
				iterations, subject.universe().size(), blocks.size());
		return new Partition<>(blocks);
	}

	/**
	 * Passes made by the last {@link #refine()} call.
	 */
	public int iterations() {
		return iterations;
	}

	/**
	 * The signature of an element against a given partition: its edges as
	 * sorted {@code symbol->blockIndex} pairs.
	 *
	 * @param element the element whose edges are read
	 * @param partition the partition the targets are looked up in
	 * @return the pairs joined by {@code ';'}, empty for an element without edges
	 */
	public String signature(T element, Partition<T> partition) {
		Map<T, Integer> index = new IdentityHashMap<>();
		for (int i = 0; i < partition.blockCount(); i++) {
			for (T member : partition.members(i)) {
				index.put(member, i);
			}
		}
		return signature(element, index);
	}

	private List<Set<T>> initialBlocks() {
		Map<String, Set<T>> byKey = new TreeMap<>();
		for (T element : subject.universe()) {
			byKey.computeIfAbsent(subject.initialKey(element), k -> new LinkedHashSet<>()).add(element);
		}
		return new ArrayList<>(byKey.values());
	}

	private String signature(T element, Map<T, Integer> index) {
		List<String> pairs = new ArrayList<>();
		for (Edge<T> edge : subject.edges(element)) {
			Integer target = index.get(edge.target());
			if (target == null) {
				throw new IllegalStateException("Edge '" + edge.symbol() + "' from " + element
						+ " targets " + edge.target() + ", which is outside the universe");
			}
			pairs.add(edge.symbol() + "->" + target);
		}
		pairs.sort(null);
		return String.join(";", pairs);
	}

	private static <T> Map<T, Integer> indexOf(List<Set<T>> blocks) {
		Map<T, Integer> index = new IdentityHashMap<>();
		for (int i = 0; i < blocks.size(); i++) {
			for (T member : blocks.get(i)) {
				index.put(member, i);
			}
		}
		return index;
	}
}
