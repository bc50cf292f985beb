package org.javai.csskit.automaton;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A state of a deterministic automaton: an id, an accepting flag and an
 * ordered symbol-to-target table. The equivalence class stays {@code null}
 * until a minimization run assigns one.
 */
public final class AutomatonState {

	private final String id;
	private final boolean accepting;
	private final Map<String, String> transitions;
	private Integer equivalenceClass;
	private final Map<String, Object> metadata = new LinkedHashMap<>();

	public AutomatonState(String id, boolean accepting, Map<String, String> transitions) {
		this.id = Objects.requireNonNull(id, "id must not be null");
		this.accepting = accepting;
		this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(
				Objects.requireNonNull(transitions, "transitions must not be null")));
	}

	public String getId() {
		return id;
	}

	public boolean isAccepting() {
		return accepting;
	}

	public Map<String, String> getTransitions() {
		return transitions;
	}

	/**
	 * @return the target state id, or {@code null} if there is no transition on the symbol
	 */
	public String target(String symbol) {
		return transitions.get(symbol);
	}

	public Integer getEquivalenceClass() {
		return equivalenceClass;
	}

	public void setEquivalenceClass(Integer equivalenceClass) {
		this.equivalenceClass = equivalenceClass;
	}

	public Map<String, Object> getMetadata() {
		return metadata;
	}

	@Override
	public String toString() {
		return id + (accepting ? "*" : "") + transitions;
	}
}
