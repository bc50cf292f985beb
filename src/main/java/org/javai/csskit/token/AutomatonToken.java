package org.javai.csskit.token;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A token seen as a state of the token-stream automaton: the token itself, the
 * transitions leaving it and, once minimized, its equivalence class.
 * <p>
 * Instances are immutable. {@link #withTransition} and
 * {@link #withEquivalenceClass} return updated copies and leave the receiver
 * and the wrapped {@link CssToken} untouched.
 *
 * @param token the wrapped token
 * @param transitions input symbol to target token id, sorted by symbol
 * @param equivalenceClass the class assigned by minimization, {@code null} before
 */
public record AutomatonToken(CssToken token, Map<String, Integer> transitions, Integer equivalenceClass) {

	public AutomatonToken {
		if (token == null) {
			throw new IllegalArgumentException("Token cannot be null");
		}
		transitions = transitions == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(transitions));
	}

	public static AutomatonToken of(CssToken token) {
		return new AutomatonToken(token, Map.of(), null);
	}

	/**
	 * @param symbol input symbol
	 * @param targetId id of the token reached on the symbol
	 * @return a copy with the transition added, replacing any earlier one on the same symbol
	 */
	public AutomatonToken withTransition(String symbol, int targetId) {
		Map<String, Integer> updated = new TreeMap<>(transitions);
		updated.put(symbol, targetId);
		return new AutomatonToken(token, updated, equivalenceClass);
	}

	/**
	 * @param classId the equivalence class
	 * @return a copy carrying the class
	 */
	public AutomatonToken withEquivalenceClass(int classId) {
		return new AutomatonToken(token, transitions, classId);
	}

	public Optional<Integer> transition(String symbol) {
		return Optional.ofNullable(transitions.get(symbol));
	}

	public boolean hasTransition(String symbol) {
		return transitions.containsKey(symbol);
	}

	public boolean isMinimized() {
		return equivalenceClass != null;
	}

	/**
	 * The wrapped token's signature followed by its transition symbols, which is
	 * what two tokens must share to be merged.
	 */
	public String signature() {
		return token.signature() + "|" + String.join(",", transitions.keySet());
	}
}
