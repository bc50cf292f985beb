package org.javai.csskit.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disjoint, non-empty blocks covering a universe of elements. Block indexes
 * are positions in {@link #blocks()}. Elements are tracked by identity.
 *
 * @param <T> element type
 */
public final class Partition<T> {

	private final List<Set<T>> blocks;
	private final Map<T, Integer> index = new IdentityHashMap<>();

	Partition(List<? extends Set<T>> blocks) {
		List<Set<T>> copy = new ArrayList<>(blocks.size());
		for (Set<T> block : blocks) {
			if (block.isEmpty()) {
				throw new IllegalArgumentException("Partition blocks must not be empty");
			}
			int blockIndex = copy.size();
			for (T member : block) {
				if (index.put(member, blockIndex) != null) {
					throw new IllegalArgumentException("Element " + member + " appears in more than one block");
				}
			}
			copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(block)));
		}
		this.blocks = Collections.unmodifiableList(copy);
	}

	public List<Set<T>> blocks() {
		return blocks;
	}

	public int blockCount() {
		return blocks.size();
	}

	public int size() {
		return index.size();
	}

	public boolean contains(T element) {
		return index.containsKey(element);
	}

	/**
	 * @param element a member of the universe
	 * @return the index of the block holding it
	 * @throws IllegalArgumentException if the element is not part of the universe
	 */
	public int blockOf(T element) {
		Integer blockIndex = index.get(element);
		if (blockIndex == null) {
			throw new IllegalArgumentException("Element " + element + " is not part of this partition");
		}
		return blockIndex;
	}

	public Set<T> members(int blockIndex) {
		return blocks.get(blockIndex);
	}

	public boolean sameBlock(T a, T b) {
		return blockOf(a) == blockOf(b);
	}

	/**
	 * Block index to members, in block order.
	 */
	public Map<Integer, Set<T>> asMap() {
		Map<Integer, Set<T>> map = new LinkedHashMap<>();
		for (int i = 0; i < blocks.size(); i++) {
			map.put(i, blocks.get(i));
		}
		return map;
	}

	@Override
	public String toString() {
		return blocks.toString();
	}
}
