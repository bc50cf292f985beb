package org.javai.csskit.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.csskit.automaton.Automaton;
import org.javai.csskit.automaton.AutomatonState;
import org.javai.csskit.automaton.MinimizationResult;
import org.javai.csskit.automaton.OptimizationMetrics;
import org.javai.csskit.automaton.StateMachineMinimizer;
import org.javai.csskit.token.CssTokenType;

/**
 * The parser's declared transition table, and its view as an {@link Automaton}
 * that can be minimized.
 * <p>
 * A token kind with no entry for the current state leaves the state unchanged.
 */
public final class CssStateMachine {

	private final Map<ParserState, Map<CssTokenType, ParserState>> transitions = new EnumMap<>(ParserState.class);
	private MinimizationResult<AutomatonState> minimization;

	public CssStateMachine() {
		for (ParserState state : ParserState.values()) {
			transitions.put(state, new LinkedHashMap<>());
		}

		on(ParserState.INITIAL, CssTokenType.AT_KEYWORD, ParserState.AT_RULE_PRELUDE);
		onSelectors(ParserState.INITIAL, ParserState.SELECTOR);
		on(ParserState.INITIAL, CssTokenType.EOF, ParserState.EOF);

		on(ParserState.AT_RULE_PRELUDE, CssTokenType.START_BLOCK, ParserState.AT_RULE_BLOCK);
		on(ParserState.AT_RULE_PRELUDE, CssTokenType.SEMICOLON, ParserState.INITIAL);
		on(ParserState.AT_RULE_PRELUDE, CssTokenType.EOF, ParserState.EOF);

		on(ParserState.AT_RULE_BLOCK, CssTokenType.END_BLOCK, ParserState.INITIAL);
		on(ParserState.AT_RULE_BLOCK, CssTokenType.AT_KEYWORD, ParserState.AT_RULE_PRELUDE);
		onSelectors(ParserState.AT_RULE_BLOCK, ParserState.SELECTOR);
		on(ParserState.AT_RULE_BLOCK, CssTokenType.PROPERTY, ParserState.RULE_BLOCK);
		on(ParserState.AT_RULE_BLOCK, CssTokenType.EOF, ParserState.EOF);

		on(ParserState.SELECTOR, CssTokenType.START_BLOCK, ParserState.RULE_BLOCK);
		on(ParserState.SELECTOR, CssTokenType.EOF, ParserState.EOF);

		on(ParserState.RULE_BLOCK, CssTokenType.END_BLOCK, ParserState.INITIAL);
		on(ParserState.RULE_BLOCK, CssTokenType.PROPERTY, ParserState.RULE_BLOCK);
		on(ParserState.RULE_BLOCK, CssTokenType.FUNCTION, ParserState.FUNCTION_ARGS);
		on(ParserState.RULE_BLOCK, CssTokenType.EOF, ParserState.EOF);

		on(ParserState.FUNCTION_ARGS, CssTokenType.CLOSE_PAREN, ParserState.RULE_BLOCK);
		on(ParserState.FUNCTION_ARGS, CssTokenType.FUNCTION, ParserState.FUNCTION_ARGS);
		on(ParserState.FUNCTION_ARGS, CssTokenType.EOF, ParserState.EOF);
	}

	private void on(ParserState from, CssTokenType symbol, ParserState to) {
		transitions.get(from).put(symbol, to);
	}

	private void onSelectors(ParserState from, ParserState to) {
		for (CssTokenType type : CssTokenType.values()) {
			if (type.isSelector()) {
				on(from, type, to);
			}
		}
	}

	/**
	 * @param from the current state
	 * @param symbol the kind of the token just processed
	 * @return the next state, or {@code null} if the table has no entry
	 */
	public ParserState next(ParserState from, CssTokenType symbol) {
		return transitions.get(from).get(symbol);
	}

	public Map<CssTokenType, ParserState> transitionsFrom(ParserState state) {
		return Collections.unmodifiableMap(transitions.get(state));
	}

	public ParserState initialState() {
		return ParserState.INITIAL;
	}

	/**
	 * The transition table as an automaton: state ids are {@link ParserState#id()},
	 * symbols are token kind names.
	 */
	public Automaton toAutomaton() {
		List<AutomatonState> states = new ArrayList<>();
		for (ParserState state : ParserState.values()) {
			Map<String, String> edges = new LinkedHashMap<>();
			transitions.get(state).forEach((symbol, target) -> edges.put(symbol.name(), target.id()));
			states.add(new AutomatonState(state.id(), state.isAccepting(), edges));
		}
		return new Automaton(states, ParserState.INITIAL.id());
	}

	/**
	 * Minimizes the automaton once; later calls return the cached result.
	 *
	 * @param minimizer used on the first call only
	 * @return the cached minimization
	 */
	public MinimizationResult<AutomatonState> minimize(StateMachineMinimizer minimizer) {
		if (minimization == null) {
			minimization = minimizer.minimize(toAutomaton());
		}
		return minimization;
	}

	public boolean isMinimized() {
		return minimization != null;
	}

	public Optional<OptimizationMetrics> metrics() {
		return minimization == null ? Optional.empty() : Optional.of(minimization.metrics());
	}

	/**
	 * @param state a parser state
	 * @return the class of the state, empty before minimization
	 */
	public Optional<Integer> equivalenceClassOf(ParserState state) {
		if (minimization == null) {
			return Optional.empty();
		}
		for (int i = 0; i < minimization.partition().blockCount(); i++) {
			for (AutomatonState member : minimization.partition().members(i)) {
				if (member.getId().equals(state.id())) {
					return Optional.of(i);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Text description of the states, transitions, classes and metrics, for debugging.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder("CSS state machine\n");
		sb.append("\nStates (").append(ParserState.values().length).append("):\n");
		for (ParserState state : ParserState.values()) {
			sb.append("- ").append(state.id())
					.append(state.isAccepting() ? " (accepting" : " (non-accepting")
					.append(equivalenceClassOf(state).map(c -> ", class " + c).orElse(", no class"))
					.append(")\n");
			transitions.get(state).forEach((symbol, target) ->
					sb.append("    ").append(symbol.name().toLowerCase(Locale.ROOT)).append(" -> ")
							.append(target.id()).append('\n'));
		}
		if (minimization != null) {
			sb.append("\nEquivalence classes (").append(minimization.partition().blockCount()).append("):\n");
			List<Set<AutomatonState>> blocks = minimization.partition().blocks();
			for (int i = 0; i < blocks.size(); i++) {
				sb.append("- class ").append(i).append(": ")
						.append(String.join(", ", blocks.get(i).stream().map(AutomatonState::getId).toList()))
						.append('\n');
			}
			sb.append("\nMetrics: ").append(minimization.metrics()).append('\n');
		}
		return sb.toString();
	}
}
