package org.javai.csskit.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimizes a deterministic automaton by partition refinement.
 * <p>
 * States start split into accepting and non-accepting blocks; refinement then
 * separates states whose transitions lead to different blocks. The result
 * carries the final partition, the metrics and the quotient automaton, which
 * has one state per class, named after the class representative (its first
 * member) and wired through the representatives' transitions.
 */
public class StateMachineMinimizer {

	private static final Logger logger = LoggerFactory.getLogger(StateMachineMinimizer.class);

	private final MinimizerOptions options;

	public StateMachineMinimizer() {
		this(MinimizerOptions.defaults());
	}

	public StateMachineMinimizer(MinimizerOptions options) {
		this.options = options != null ? options : MinimizerOptions.defaults();
	}

	/**
	 * Computes the coarsest partition of the automaton's states and builds the
	 * quotient automaton over it.
	 *
	 * @param automaton the automaton to minimize; it is not modified
	 * @return the partition, the metrics and the quotient
	 * @throws IllegalArgumentException if the automaton is null
	 */
	public MinimizationResult<AutomatonState> minimize(Automaton automaton) {
		if (automaton == null) {
			throw new IllegalArgumentException("Automaton cannot be null");
		}
		Automaton source = options.removeUnreachableStates() ? automaton.withoutUnreachableStates() : automaton;
		if (source != automaton) {
			logger.debug("Removed {} unreachable states", automaton.size() - source.size());
		}

		PartitionRefiner<AutomatonState> refiner = new PartitionRefiner<>(new StateSubject(source));
		Partition<AutomatonState> partition = refiner.refine();

		if (options.stampMetadata()) {
			for (int i = 0; i < partition.blockCount(); i++) {
				for (AutomatonState state : partition.members(i)) {
					state.setEquivalenceClass(i);
				}
			}
		}

		Automaton quotient = quotient(source, partition);
		OptimizationMetrics metrics = OptimizationMetrics.of(automaton.size(), partition.blockCount());
		logger.debug("Minimized automaton: {}", metrics);
		return new MinimizationResult<>(partition, metrics, refiner.iterations(), quotient);
	}

	private static Automaton quotient(Automaton source, Partition<AutomatonState> partition) {
		List<AutomatonState> representatives = new ArrayList<>();
		for (Set<AutomatonState> block : partition.blocks()) {
			representatives.add(block.iterator().next());
		}

		List<AutomatonState> states = new ArrayList<>();
		for (int i = 0; i < representatives.size(); i++) {
			AutomatonState representative = representatives.get(i);
			Map<String, String> transitions = new LinkedHashMap<>();
			representative.getTransitions().forEach((symbol, target) -> {
				int targetBlock = partition.blockOf(source.getState(target));
				transitions.put(symbol, representatives.get(targetBlock).getId());
			});
			AutomatonState state = new AutomatonState(representative.getId(), representative.isAccepting(), transitions);
			state.setEquivalenceClass(i);
			states.add(state);
		}

		int initialBlock = partition.blockOf(source.getInitialState());
		return new Automaton(states, representatives.get(initialBlock).getId());
	}

	private record StateSubject(Automaton automaton) implements PartitionRefiner.Subject<AutomatonState> {

		@Override
		public Collection<AutomatonState> universe() {
			return automaton.getStates();
		}

		@Override
		public String initialKey(AutomatonState state) {
			return state.isAccepting() ? "0:accepting" : "1:rejecting";
		}

		@Override
		public List<PartitionRefiner.Edge<AutomatonState>> edges(AutomatonState state) {
			List<PartitionRefiner.Edge<AutomatonState>> edges = new ArrayList<>();
			state.getTransitions().forEach((symbol, target) -> {
				AutomatonState targetState = automaton.getState(target);
				if (targetState == null) {
					throw new IllegalStateException("Transition from " + state.getId() + " on '" + symbol
							+ "' targets unknown state " + target);
				}
				edges.add(new PartitionRefiner.Edge<>(symbol, targetState));
			});
			return edges;
		}
	}
}
