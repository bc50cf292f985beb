package org.javai.csskit.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.javai.csskit.ast.CssAst;
import org.javai.csskit.automaton.AstMinimizer;
import org.javai.csskit.automaton.MinimizationResult;
import org.javai.csskit.automaton.StateMachineMinimizer;
import org.javai.csskit.automaton.AutomatonState;
import org.javai.csskit.diagnostic.Diagnostic;
import org.javai.csskit.reader.ReadResult;
import org.javai.csskit.reader.StructuralReader;
import org.javai.csskit.token.CssToken;
import org.javai.csskit.token.CssTokenBuilder;
import org.javai.csskit.token.CssTokenType;
import org.javai.csskit.token.TokenPosition;
import org.javai.csskit.tokenizer.CssTokenizer;
import org.javai.csskit.tokenizer.TokenizerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State-machine parser producing a stylesheet tree.
 * <p>
 * Tokens are fed one at a time to the current {@link ParserState}, which
 * updates the {@link ParsingContext}; the {@link CssStateMachine} table then
 * names the next state. After a token that closes something (a brace, a
 * paren, a semicolon) the state is re-derived from the innermost open
 * container, so nested blocks return to the right place.
 * <p>
 * Syntax errors never throw. An unexpected token is reported; with error
 * recovery on, tokens are then skipped up to the next {@code ;}, {@code }} or
 * end of input, where the partial construct is dropped and parsing resumes.
 * A block opening where a rule or at-rule should start is skipped whole with
 * {@link StructuralReader#skipBlock}.
 * With recovery off the parse stops and the partial tree is returned.
 */
public class CssParser {

	private static final Logger logger = LoggerFactory.getLogger(CssParser.class);

	private final ParserOptions options;
	private final CssStateMachine stateMachine = new CssStateMachine();
	private Consumer<Diagnostic> listener;

	public CssParser() {
		this(ParserOptions.defaults());
	}

	public CssParser(ParserOptions options) {
		this.options = options != null ? options : ParserOptions.defaults();
	}

	/**
	 * Registers a callback invoked for every diagnostic as it is produced.
	 *
	 * @param listener the callback, or {@code null} to remove it
	 * @return this parser
	 */
	public CssParser onDiagnostic(Consumer<Diagnostic> listener) {
		this.listener = listener;
		return this;
	}

	public ParserOptions getOptions() {
		return options;
	}

	public CssStateMachine getStateMachine() {
		return stateMachine;
	}

	/**
	 * Tokenizes and parses stylesheet source. Never throws on malformed input.
	 *
	 * @param source the stylesheet; {@code null} is read as empty
	 * @return the tree with the lexical diagnostics followed by the syntactic ones
	 */
	public ParseResult parse(String source) {
		TokenizerResult tokenized = new CssTokenizer(source != null ? source : "", options.tokenizer()).tokenize();
		if (listener != null) {
			tokenized.diagnostics().forEach(listener);
		}
		ParseResult parsed = parseTokens(tokenized.tokens());

		List<Diagnostic> all = new ArrayList<>(tokenized.diagnostics());
		all.addAll(parsed.diagnostics());
		return new ParseResult(parsed.ast(), all);
	}

	/**
	 * Parses an already tokenized stylesheet. A missing trailing EOF token is supplied.
	 *
	 * @param tokens the token stream, as produced by {@link CssTokenizer}
	 * @return the tree and the syntactic diagnostics
	 */
	public ParseResult parseTokens(List<CssToken> tokens) {
		ParsingContext context = new ParsingContext(options, listener);
		ParserState state = stateMachine.initialState();
		boolean stopped = false;
		boolean finished = false;

		List<CssToken> stream = withEof(tokens);
		for (int i = 0; i < stream.size(); i++) {
			CssToken token = stream.get(i);
			if (token.isType(CssTokenType.WHITESPACE) || token.isType(CssTokenType.ERROR)) {
				continue;
			}
			if (token.isType(CssTokenType.COMMENT)) {
				if (options.preserveComments() && !context.isRecovering()) {
					context.addComment(token);
				}
				continue;
			}

			if (context.isRecovering()) {
				if (!ParserState.isSyncToken(token)) {
					continue;
				}
				logger.debug("Resynchronized at {} on line {}", token.type(), token.line());
				context.resync(token);
				state = context.anchorState();
				if (token.isType(CssTokenType.EOF)) {
					state = enterEof(token, context);
					finished = true;
					break;
				}
				continue;
			}

			ParserState before = state;
			if (!state.process(token, context)) {
				context.error("Unexpected token: " + describe(token) + " in " + state.id(), token);
				if (!options.errorRecovery()) {
					logger.debug("Stopping at line {}: error recovery is off", token.line());
					stopped = true;
					break;
				}
				if (token.isType(CssTokenType.START_BLOCK) && isStatementLevel(state)) {
					// a block where a statement should start is skipped whole, nested blocks included
					ReadResult<Integer> skipped = StructuralReader.skipBlock(stream, i);
					logger.debug("Skipped a stray block of {} tokens at line {}", skipped.value(), token.line());
					context.resync(token);
					state = context.anchorState();
					i = skipped.endIndex() - 1;
				} else if (ParserState.isSyncToken(token)) {
					context.resync(token);
					state = context.anchorState();
					if (token.isType(CssTokenType.EOF)) {
						state = enterEof(token, context);
						finished = true;
						break;
					}
				} else {
					logger.debug("Recovering from {} at line {}", token.type(), token.line());
					context.setRecovering(true);
				}
				continue;
			}

			ParserState next = stateMachine.next(state, token.type());
			if (next != null && next != state) {
				logger.trace("{} --{}--> {}", state.id(), token.type(), next.id());
				state = next;
			}
			if (state == ParserState.EOF) {
				enterEof(token, context);
				finished = true;
				break;
			}
			if (closesConstruct(token, before)) {
				state = context.anchorState();
			}
		}

		CssAst ast = new CssAst(context.getRoot());
		if (!stopped) {
			runOptionalPasses(ast);
		}
		logger.debug("Parsed {} tokens into {} nodes with {} diagnostics{}", tokens.size(), ast.nodeCount(),
				context.getDiagnostics().size(), finished ? "" : " (stopped early)");
		return new ParseResult(ast, context.getDiagnostics());
	}

	private ParserState enterEof(CssToken token, ParsingContext context) {
		ParserState.EOF.process(token, context);
		return ParserState.EOF;
	}

	private void runOptionalPasses(CssAst ast) {
		if (options.stateMinimization()) {
			MinimizationResult<AutomatonState> result = stateMachine.minimize(new StateMachineMinimizer());
			ast.attachMetrics(CssAst.STATE_METRICS, result.metrics());
		}
		if (options.astOptimization()) {
			new AstMinimizer().minimize(ast);
		}
	}

	/**
	 * Whether the token ends a construct, after which the state is taken from the
	 * innermost open container. A {@code ')'} read in a selector belongs to a
	 * pseudo-class argument and ends nothing.
	 *
	 * @param token the token just processed
	 * @param before the state the token was processed in
	 * @return true when the state must be re-anchored
	 */
	private static boolean closesConstruct(CssToken token, ParserState before) {
		if (token.isType(CssTokenType.CLOSE_PAREN)) {
			return before != ParserState.SELECTOR;
		}
		return token.isType(CssTokenType.END_BLOCK) || token.isType(CssTokenType.SEMICOLON);
	}

	private static boolean isStatementLevel(ParserState state) {
		return state == ParserState.INITIAL || state == ParserState.AT_RULE_BLOCK;
	}

	private static List<CssToken> withEof(List<CssToken> tokens) {
		if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).isType(CssTokenType.EOF)) {
			return tokens;
		}
		int offset = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
		int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
		List<CssToken> completed = new ArrayList<>(tokens);
		completed.add(new CssTokenBuilder().eof(new TokenPosition(line, 1, offset, offset)));
		return completed;
	}

	private static String describe(CssToken token) {
		return token.isType(CssTokenType.EOF) ? "end of input" : token.type() + " '" + token.value() + "'";
	}

	/**
	 * Text description of the underlying state machine.
	 */
	public String describe() {
		return stateMachine.describe();
	}
}
