package org.javai.csskit.parser;

import org.javai.csskit.token.CssToken;
import org.javai.csskit.token.CssTokenType;

/**
 * The closed set of parser states. Each state consumes one token at a time
 * and applies its effect to the {@link ParsingContext}; which state comes next
 * is decided by the {@link CssStateMachine} transition table.
 */
public enum ParserState {

	INITIAL("initial") {
		@Override
		public boolean process(CssToken token, ParsingContext context) {
			switch (token.type()) {
				case AT_KEYWORD -> context.openAtRule(token);
				case SEMICOLON, EOF -> {
				}
				default -> {
					if (!token.isSelector()) {
						return false;
					}
					context.beginSelector(token);
				}
			}
			return true;
		}
	},

	AT_RULE_PRELUDE("at-rule-prelude") {
		@Override
		public boolean process(CssToken token, ParsingContext context) {
			switch (token.type()) {
				case START_BLOCK -> context.openAtRuleBlock();
				case SEMICOLON -> context.pop();
				case EOF -> {
				}
				case END_BLOCK -> {
					return false;
				}
				default -> context.appendPrelude(token);
			}
			return true;
		}
	},

	AT_RULE_BLOCK("at-rule-block") {
		@Override
		public boolean process(CssToken token, ParsingContext context) {
			switch (token.type()) {
				case END_BLOCK -> context.closeBlock(token);
				case AT_KEYWORD -> context.openAtRule(token);
				case PROPERTY -> context.beginDeclaration(token);
				case SEMICOLON, EOF -> {
				}
				default -> {
					if (!token.isSelector()) {
						return false;
					}
					context.beginSelector(token);
				}
			}
			return true;
		}
	},

	SELECTOR("selector") {
		@Override
		public boolean process(CssToken token, ParsingContext context) {
			switch (token.type()) {
				case START_BLOCK -> context.openRule();
				case EOF -> {
					context.error("Selector '" + context.selectorText() + "' has no block", token);
					context.discardSelector();
				}
				case COMMA, OPEN_PAREN, CLOSE_PAREN, VALUE, NUMBER, STRING -> context.appendSelector(token);
				default -> {
					if (!token.isSelector()) {
						return false;
					}
					context.appendSelector(token);
				}
			}
			return true;
		}
	},

	RULE_BLOCK("rule-block") {
		@Override
		public boolean process(CssToken token, ParsingContext context) {
			switch (token.type()) {
				case END_BLOCK -> context.closeBlock(token);
				case PROPERTY -> context.beginDeclaration(token);
				case COLON -> {
					return context.startValue();
				}
				case SEMICOLON, EOF -> context.finishDeclaration(token);
				case IMPORTANT_FLAG -> {
					if (!context.hasOpenDeclaration()) {
						return false;
					}
					context.markImportant();
				}
				case FUNCTION -> {
					if (!context.isExpectingValue()) {
						return false;
					}
					context.openFunction(token);
				}
				case VALUE, NUMBER, UNIT, COLOR, STRING, URL, COMMA -> {
					if (!context.isExpectingValue()) {
						return false;
					}
					context.addValue(token);
				}
				default -> {
					return false;
				}
			}
			return true;
		}
	},

	FUNCTION_ARGS("function-args") {
		@Override
		public boolean process(CssToken token, ParsingContext context) {
			switch (token.type()) {
				case OPEN_PAREN -> context.openParen(token);
				case CLOSE_PAREN -> context.closeParen(token);
				case FUNCTION -> context.openFunction(token);
				case VALUE, NUMBER, UNIT, COLOR, STRING, URL, COMMA, COLON -> context.addValue(token);
				case EOF -> context.finishDeclaration(token);
				default -> {
					return false;
				}
			}
			return true;
		}
	},

	EOF("eof") {
		@Override
		public boolean process(CssToken token, ParsingContext context) {
			if (context.getBlockLevel() > 0) {
				context.error("Unclosed blocks at end of file: " + context.getBlockLevel(), token);
			}
			return true;
		}

		@Override
		public boolean isAccepting() {
			return true;
		}
	};

	private final String id;

	ParserState(String id) {
		this.id = id;
	}

	/**
	 * Applies the effect of one token.
	 *
	 * @param token the token read
	 * @param context the parse being built
	 * @return {@code false} if the token is not expected in this state; the context is then unchanged
	 */
	public abstract boolean process(CssToken token, ParsingContext context);

	public boolean isAccepting() {
		return false;
	}

	/**
	 * Stable lower-case id, used as the automaton state id.
	 */
	public String id() {
		return id;
	}

	static boolean isSyncToken(CssToken token) {
		return token.isType(CssTokenType.SEMICOLON) || token.isType(CssTokenType.END_BLOCK)
				|| token.isType(CssTokenType.EOF);
	}
}
