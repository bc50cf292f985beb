package org.javai.csskit.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.javai.csskit.automaton.Automaton;
import org.javai.csskit.automaton.AutomatonState;
import org.javai.csskit.automaton.MinimizationResult;
import org.javai.csskit.automaton.StateMachineMinimizer;
import org.javai.csskit.token.CssTokenType;
import org.junit.jupiter.api.Test;

class CssStateMachineTest {

	@Test
	void declaredTransitions() {
		CssStateMachine machine = new CssStateMachine();

		assertThat(machine.initialState()).isEqualTo(ParserState.INITIAL);
		assertThat(machine.next(ParserState.INITIAL, CssTokenType.AT_KEYWORD)).isEqualTo(ParserState.AT_RULE_PRELUDE);
		assertThat(machine.next(ParserState.INITIAL, CssTokenType.CLASS_SELECTOR)).isEqualTo(ParserState.SELECTOR);
		assertThat(machine.next(ParserState.SELECTOR, CssTokenType.START_BLOCK)).isEqualTo(ParserState.RULE_BLOCK);
		assertThat(machine.next(ParserState.RULE_BLOCK, CssTokenType.FUNCTION)).isEqualTo(ParserState.FUNCTION_ARGS);
		assertThat(machine.next(ParserState.FUNCTION_ARGS, CssTokenType.CLOSE_PAREN)).isEqualTo(ParserState.RULE_BLOCK);
		assertThat(machine.next(ParserState.AT_RULE_BLOCK, CssTokenType.PROPERTY)).isEqualTo(ParserState.RULE_BLOCK);
	}

	@Test
	void missingEntryMeansStay() {
		CssStateMachine machine = new CssStateMachine();

		assertThat(machine.next(ParserState.RULE_BLOCK, CssTokenType.VALUE)).isNull();
		assertThat(machine.next(ParserState.EOF, CssTokenType.EOF)).isNull();
		assertThat(machine.transitionsFrom(ParserState.EOF)).isEmpty();
	}

	@Test
	void everySelectorKindStartsASelector() {
		CssStateMachine machine = new CssStateMachine();

		for (CssTokenType type : CssTokenType.values()) {
			if (type.isSelector()) {
				assertThat(machine.next(ParserState.INITIAL, type)).as(type.name()).isEqualTo(ParserState.SELECTOR);
				assertThat(machine.next(ParserState.AT_RULE_BLOCK, type)).as(type.name()).isEqualTo(ParserState.SELECTOR);
			}
		}
	}

	@Test
	void automatonViewUsesStateIds() {
		Automaton automaton = new CssStateMachine().toAutomaton();

		assertThat(automaton.size()).isEqualTo(ParserState.values().length);
		assertThat(automaton.getInitialStateId()).isEqualTo("initial");
		assertThat(automaton.getState("eof").isAccepting()).isTrue();
		assertThat(automaton.getState("rule-block").isAccepting()).isFalse();
		assertThat(automaton.getState("selector").getTransitions()).containsEntry("START_BLOCK", "rule-block");
	}

	@Test
	void everyStateIsDistinguishable() {
		CssStateMachine machine = new CssStateMachine();
		assertThat(machine.equivalenceClassOf(ParserState.INITIAL)).isEmpty();
		assertThat(machine.metrics()).isEmpty();

		MinimizationResult<AutomatonState> result = machine.minimize(new StateMachineMinimizer());

		assertThat(result.partition().blockCount()).isEqualTo(7);
		assertThat(result.metrics().ratio()).isEqualTo(1.0);
		Set<Integer> classes = new HashSet<>();
		for (ParserState state : ParserState.values()) {
			classes.add(machine.equivalenceClassOf(state).orElseThrow());
		}
		assertThat(classes).hasSize(7);
	}

	@Test
	void minimizationIsCached() {
		CssStateMachine machine = new CssStateMachine();

		MinimizationResult<AutomatonState> first = machine.minimize(new StateMachineMinimizer());

		assertThat(machine.minimize(new StateMachineMinimizer())).isSameAs(first);
		assertThat(machine.isMinimized()).isTrue();
		assertThat(machine.metrics()).contains(first.metrics());
	}

	@Test
	void describeListsStatesAndTransitions() {
		CssStateMachine machine = new CssStateMachine();

		String before = machine.describe();
		machine.minimize(new StateMachineMinimizer());
		String after = machine.describe();

		assertThat(before)
				.contains("- eof (accepting, no class)")
				.contains("end_block -> initial")
				.doesNotContain("Equivalence classes");
		assertThat(after)
				.contains("Equivalence classes (7):")
				.contains("Metrics: 7 -> 7 (ratio 1.000)");
	}
}
