package org.javai.csskit.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A deterministic finite automaton over string symbols.
 * <p>
 * Construction checks that the initial state exists and that every
 * transition targets a known state. The alphabet is the sorted set of
 * symbols used by any transition.
 */
public final class Automaton {

	private final Map<String, AutomatonState> states;
	private final String initialStateId;
	private final Set<String> alphabet;

	/**
	 * @param states the states, with their transitions by target id
	 * @param initialStateId id of the start state
	 * @throws IllegalArgumentException if state ids repeat or the initial state is unknown
	 * @throws IllegalStateException if a transition targets an unknown state
	 */
	public Automaton(List<AutomatonState> states, String initialStateId) {
		Map<String, AutomatonState> byId = new LinkedHashMap<>();
		for (AutomatonState state : states) {
			if (byId.put(state.getId(), state) != null) {
				throw new IllegalArgumentException("Duplicate state id: " + state.getId());
			}
		}
		if (!byId.containsKey(initialStateId)) {
			throw new IllegalArgumentException("Unknown initial state: " + initialStateId);
		}
		Set<String> symbols = new TreeSet<>();
		for (AutomatonState state : byId.values()) {
			state.getTransitions().forEach((symbol, target) -> {
				if (!byId.containsKey(target)) {
					throw new IllegalStateException("Transition from " + state.getId() + " on '" + symbol
							+ "' targets unknown state " + target);
				}
				symbols.add(symbol);
			});
		}
		this.states = Collections.unmodifiableMap(byId);
		this.initialStateId = initialStateId;
		this.alphabet = Collections.unmodifiableSet(symbols);
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<AutomatonState> getStates() {
		return List.copyOf(states.values());
	}

	/**
	 * @param id a state id
	 * @return the state, or {@code null} if there is none with that id
	 */
	public AutomatonState getState(String id) {
		return states.get(id);
	}

	public AutomatonState getInitialState() {
		return states.get(initialStateId);
	}

	public String getInitialStateId() {
		return initialStateId;
	}

	public Set<String> getAlphabet() {
		return alphabet;
	}

	public int size() {
		return states.size();
	}

	public List<Transition> transitions() {
		List<Transition> result = new ArrayList<>();
		for (AutomatonState state : states.values()) {
			state.getTransitions().forEach((symbol, target) -> result.add(new Transition(state.getId(), symbol, target)));
		}
		return result;
	}

	/**
	 * Follows a symbol sequence from the initial state.
	 *
	 * @param symbols the input, read left to right
	 * @return the state reached, or {@code null} if some symbol has no transition
	 */
	public AutomatonState run(List<String> symbols) {
		AutomatonState current = getInitialState();
		for (String symbol : symbols) {
			String target = current.target(symbol);
			if (target == null) {
				return null;
			}
			current = states.get(target);
		}
		return current;
	}

	public boolean accepts(List<String> symbols) {
		AutomatonState end = run(symbols);
		return end != null && end.isAccepting();
	}

	/**
	 * Ids of the states reachable from the initial state, in breadth-first order.
	 */
	public Set<String> reachableStateIds() {
		Set<String> seen = new LinkedHashSet<>();
		Deque<String> queue = new ArrayDeque<>();
		seen.add(initialStateId);
		queue.add(initialStateId);
		while (!queue.isEmpty()) {
			AutomatonState state = states.get(queue.poll());
			for (String target : state.getTransitions().values()) {
				if (seen.add(target)) {
					queue.add(target);
				}
			}
		}
		return seen;
	}

	/**
	 * An automaton holding only the reachable states. The state objects are shared.
	 */
	public Automaton withoutUnreachableStates() {
		Set<String> reachable = reachableStateIds();
		if (reachable.size() == states.size()) {
			return this;
		}
		List<AutomatonState> kept = new ArrayList<>();
		for (AutomatonState state : states.values()) {
			if (reachable.contains(state.getId())) {
				kept.add(state);
			}
		}
		return new Automaton(kept, initialStateId);
	}

	/**
	 * Multi-line description: one line per state with its transitions and class.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder();
		sb.append("Automaton: ").append(states.size()).append(" states, initial ").append(initialStateId)
				.append(", alphabet ").append(alphabet).append('\n');
		for (AutomatonState state : states.values()) {
			sb.append("  ").append(state.getId());
			if (state.isAccepting()) {
				sb.append(" (accepting)");
			}
			if (state.getEquivalenceClass() != null) {
				sb.append(" [class ").append(state.getEquivalenceClass()).append(']');
			}
			sb.append('\n');
			state.getTransitions().forEach((symbol, target) ->
					sb.append("    ").append(symbol).append(" -> ").append(target).append('\n'));
		}
		return sb.toString();
	}

	/**
	 * Incremental construction; transitions may name states added later.
	 */
	public static final class Builder {
		private final Map<String, Boolean> accepting = new LinkedHashMap<>();
		private final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
		private String initial;

		private Builder() {
		}

		public Builder state(String id, boolean isAccepting) {
			accepting.put(id, isAccepting);
			transitions.computeIfAbsent(id, k -> new LinkedHashMap<>());
			return this;
		}

		public Builder transition(String from, String symbol, String to) {
			transitions.computeIfAbsent(from, k -> new LinkedHashMap<>()).put(symbol, to);
			accepting.putIfAbsent(from, false);
			return this;
		}

		public Builder initial(String id) {
			this.initial = id;
			return this;
		}

		public Automaton build() {
			List<AutomatonState> states = new ArrayList<>();
			accepting.forEach((id, isAccepting) -> states.add(new AutomatonState(id, isAccepting, transitions.get(id))));
			String start = initial != null ? initial : (states.isEmpty() ? null : states.get(0).getId());
			return new Automaton(states, start);
		}
	}
}
