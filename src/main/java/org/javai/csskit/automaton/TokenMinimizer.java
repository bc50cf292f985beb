package org.javai.csskit.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.csskit.token.AutomatonToken;
import org.javai.csskit.token.CssToken;
import org.javai.csskit.token.CssTokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes equivalence classes over a token stream.
 * <p>
 * Each meaningful token is a state with one transition, labelled with the type
 * of the next meaningful token. The transition leads to the first token in the
 * stream with the same signature as that next token, so repeated constructs
 * fold back onto their first occurrence. Whitespace, comment and error tokens
 * take no part. EOF is the accepting state. Two tokens share a class when they
 * have the same signature and their transitions reach the same classes, so the
 * {@code red} of two {@code color:red} declarations closing their rules is one
 * class while the braces closing them differ if different tokens follow.
 */
public class TokenMinimizer {

	private static final Logger logger = LoggerFactory.getLogger(TokenMinimizer.class);

	/**
	 * Refines the meaningful tokens of the stream.
	 *
	 * @param tokens a token stream, normally ending with EOF
	 * @return the partition of the meaningful tokens, without a quotient automaton
	 */
	public MinimizationResult<CssToken> minimize(List<CssToken> tokens) {
		List<CssToken> universe = meaningful(tokens);
		Map<CssToken, CssToken> successors = successors(universe);
		PartitionRefiner<CssToken> refiner = new PartitionRefiner<>(new TokenSubject(universe, successors));
		Partition<CssToken> partition = refiner.refine();
		OptimizationMetrics metrics = OptimizationMetrics.of(universe.size(), partition.blockCount());
		logger.debug("Minimized {} tokens after {} passes: {}", universe.size(), refiner.iterations(), metrics);
		return new MinimizationResult<>(partition, metrics, refiner.iterations(), null);
	}

	/**
	 * Minimizes the stream and returns each meaningful token with its transition
	 * and class stamped on an {@link AutomatonToken}. The input tokens are not changed.
	 *
	 * @param tokens a token stream, normally ending with EOF
	 * @return one entry per meaningful token, in stream order
	 */
	public List<AutomatonToken> annotate(List<CssToken> tokens) {
		MinimizationResult<CssToken> result = minimize(tokens);
		List<CssToken> universe = meaningful(tokens);
		Map<CssToken, CssToken> successors = successors(universe);
		List<AutomatonToken> annotated = new ArrayList<>(universe.size());
		for (CssToken token : universe) {
			AutomatonToken state = AutomatonToken.of(token);
			CssToken next = successors.get(token);
			if (next != null) {
				state = state.withTransition(next.type().name(), next.id());
			}
			annotated.add(state.withEquivalenceClass(result.classOf(token)));
		}
		return annotated;
	}

	private static List<CssToken> meaningful(List<CssToken> tokens) {
		Set<CssToken> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		List<CssToken> universe = new ArrayList<>();
		if (tokens == null) {
			return universe;
		}
		for (CssToken token : tokens) {
			if (token.type().isWhitespaceOrComment() || token.isType(CssTokenType.ERROR)) {
				continue;
			}
			if (seen.add(token)) {
				universe.add(token);
			}
		}
		return universe;
	}

	/**
	 * Each token mapped to the transition target: the first token whose
	 * signature matches the token following it.
	 */
	private static Map<CssToken, CssToken> successors(List<CssToken> universe) {
		Map<String, CssToken> firstBySignature = new HashMap<>();
		for (CssToken token : universe) {
			firstBySignature.putIfAbsent(token.signature(), token);
		}
		Map<CssToken, CssToken> successors = new IdentityHashMap<>();
		for (int i = 0; i + 1 < universe.size(); i++) {
			successors.put(universe.get(i), firstBySignature.get(universe.get(i + 1).signature()));
		}
		return successors;
	}

	private record TokenSubject(List<CssToken> universe, Map<CssToken, CssToken> successors)
			implements PartitionRefiner.Subject<CssToken> {

		@Override
		public String initialKey(CssToken token) {
			return (token.isType(CssTokenType.EOF) ? "0" : "1") + "|" + token.signature();
		}

		@Override
		public List<PartitionRefiner.Edge<CssToken>> edges(CssToken token) {
			CssToken next = successors.get(token);
			if (next == null) {
				return List.of();
			}
			return List.of(new PartitionRefiner.Edge<>(next.type().name(), next));
		}
	}
}
