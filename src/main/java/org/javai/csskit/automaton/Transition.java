package org.javai.csskit.automaton;

/**
 * One labelled edge of an {@link Automaton}.
 *
 * @param from source state id
 * @param symbol input symbol
 * @param to target state id
 */
public record Transition(String from, String symbol, String to) {

	@Override
	public String toString() {
		return from + " --" + symbol + "--> " + to;
	}
}
