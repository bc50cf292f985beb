package org.javai.csskit.reader;

import java.util.ArrayList;
import java.util.List;
import org.javai.csskit.diagnostic.Diagnostic;
import org.javai.csskit.diagnostic.DiagnosticCategory;
import org.javai.csskit.token.CssToken;
import org.javai.csskit.token.CssTokenType;

/**
 * Stateless readers for higher-level stylesheet constructs.
 * <p>
 * Each reader takes a token list and a start index and returns a
 * {@link ReadResult} carrying what was read and the index of the first token
 * it did not consume. Whitespace, comment and error tokens are skipped
 * wherever they appear. Readers never throw on malformed input; they report
 * STRUCTURAL diagnostics instead.
 */
public final class StructuralReader {

	private StructuralReader() {
	}

	/**
	 * Reads a run of selector tokens and commas up to, but not including, the
	 * opening brace of the rule.
	 */
	public static ReadResult<SelectorRead> readSelector(List<CssToken> tokens, int start) {
		int i = skipTrivia(tokens, start);
		CssToken first = tokenAt(tokens, i);
		if (!first.isSelector()) {
			return ReadResult.failure(i, error("Expected selector but found " + first.type(), first));
		}

		List<CssToken> parts = new ArrayList<>();
		while (true) {
			CssToken token = tokenAt(tokens, i);
			if (!token.isSelector() && !token.isType(CssTokenType.COMMA) && !isSelectorArgument(token)) {
				break;
			}
			parts.add(token);
			i = skipTrivia(tokens, i + 1);
		}

		SelectorRead selector = new SelectorRead(selectorText(parts), parts);
		CssToken next = tokenAt(tokens, i);
		if (!next.isType(CssTokenType.START_BLOCK)) {
			return ReadResult.partial(selector, i, List.of(error("Expected '{' after selector", next)));
		}
		return ReadResult.success(selector, i);
	}

	/**
	 * Reads a property name and its colon. The end index points past the colon.
	 */
	public static ReadResult<PropertyRead> readProperty(List<CssToken> tokens, int start) {
		int i = skipTrivia(tokens, start);
		CssToken property = tokenAt(tokens, i);
		if (!property.isType(CssTokenType.PROPERTY)) {
			return ReadResult.failure(i, error("Expected property but found " + property.type(), property));
		}
		i = skipTrivia(tokens, i + 1);
		CssToken colon = tokenAt(tokens, i);
		if (!colon.isType(CssTokenType.COLON)) {
			return ReadResult.partial(new PropertyRead(property.value(), property), i,
					List.of(error("Expected ':' after property '" + property.value() + "'", colon)));
		}
		return ReadResult.success(new PropertyRead(property.value(), property), i + 1);
	}

	/**
	 * Reads a value run. A terminating semicolon is consumed; a closing brace
	 * or end of input is left for the caller.
	 */
	public static ReadResult<ValueRead> readValue(List<CssToken> tokens, int start) {
		int i = skipTrivia(tokens, start);
		List<CssToken> parts = new ArrayList<>();
		boolean important = false;
		int parenDepth = 0;

		while (true) {
			CssToken token = tokenAt(tokens, i);
			CssTokenType type = token.type();
			if (type == CssTokenType.EOF || type == CssTokenType.END_BLOCK || type == CssTokenType.START_BLOCK) {
				break;
			}
			if (type == CssTokenType.SEMICOLON && parenDepth == 0) {
				break;
			}
			if (type == CssTokenType.IMPORTANT_FLAG) {
				important = true;
			} else if (token.isValue() || type == CssTokenType.COMMA || type == CssTokenType.COLON
					|| type == CssTokenType.OPEN_PAREN || type == CssTokenType.CLOSE_PAREN) {
				if (type == CssTokenType.OPEN_PAREN) {
					parenDepth++;
				} else if (type == CssTokenType.CLOSE_PAREN) {
					parenDepth = Math.max(0, parenDepth - 1);
				}
				parts.add(token);
			} else {
				return ReadResult.partial(null, i, List.of(error("Unexpected " + type + " in value", token)));
			}
			i = skipTrivia(tokens, i + 1);
		}

		CssToken end = tokenAt(tokens, i);
		if (parts.isEmpty()) {
			return ReadResult.failure(i, error("Expected value", end));
		}
		ValueRead value = new ValueRead(joinAsWritten(parts), parts, important);
		if (end.isType(CssTokenType.SEMICOLON)) {
			i++;
		}
		return ReadResult.success(value, i);
	}

	/**
	 * Reads {@code property: value;}.
	 */
	public static ReadResult<DeclarationRead> readDeclaration(List<CssToken> tokens, int start) {
		ReadResult<PropertyRead> property = readProperty(tokens, start);
		if (!property.success()) {
			return ReadResult.partial(null, property.endIndex(), property.errors());
		}
		ReadResult<ValueRead> value = readValue(tokens, property.endIndex());
		if (!value.success()) {
			return ReadResult.partial(null, value.endIndex(), value.errors());
		}
		return ReadResult.success(new DeclarationRead(property.value().name(), value.value()), value.endIndex());
	}

	/**
	 * Reads a selector and the block that follows it.
	 */
	public static ReadResult<RuleRead> readRule(List<CssToken> tokens, int start) {
		ReadResult<SelectorRead> selector = readSelector(tokens, start);
		if (!selector.success()) {
			return ReadResult.partial(null, selector.endIndex(), selector.errors());
		}
		ReadResult<BlockRead> block = readBlock(tokens, selector.endIndex());
		if (block.value() == null) {
			return ReadResult.partial(null, block.endIndex(), block.errors());
		}
		return ReadResult.partial(new RuleRead(selector.value(), block.value()), block.endIndex(), block.errors());
	}

	/**
	 * Reads an at-rule: keyword, prelude and either a terminating semicolon or a block.
	 */
	public static ReadResult<AtRuleRead> readAtRule(List<CssToken> tokens, int start) {
		int i = skipTrivia(tokens, start);
		CssToken keyword = tokenAt(tokens, i);
		if (!keyword.isType(CssTokenType.AT_KEYWORD)) {
			return ReadResult.failure(i, error("Expected at-rule but found " + keyword.type(), keyword));
		}
		String name = keyword.detail() != null ? keyword.detail() : keyword.value().substring(1);

		List<CssToken> prelude = new ArrayList<>();
		i = skipTrivia(tokens, i + 1);
		while (true) {
			CssToken token = tokenAt(tokens, i);
			if (token.isType(CssTokenType.SEMICOLON) || token.isType(CssTokenType.START_BLOCK)
					|| token.isType(CssTokenType.END_BLOCK) || token.isType(CssTokenType.EOF)) {
				break;
			}
			prelude.add(token);
			i = skipTrivia(tokens, i + 1);
		}
		String preludeText = joinAsWritten(prelude);

		CssToken end = tokenAt(tokens, i);
		if (end.isType(CssTokenType.SEMICOLON)) {
			return ReadResult.success(new AtRuleRead(name, preludeText, null), i + 1);
		}
		if (end.isType(CssTokenType.START_BLOCK)) {
			ReadResult<BlockRead> block = readBlock(tokens, i);
			return ReadResult.partial(new AtRuleRead(name, preludeText, block.value()), block.endIndex(), block.errors());
		}
		return ReadResult.partial(new AtRuleRead(name, preludeText, null), i,
				List.of(error("Expected ';' or '{' after @" + name, end)));
	}

	/**
	 * Reads a block starting at its opening brace. The end index points past
	 * the matching closing brace.
	 */
	public static ReadResult<BlockRead> readBlock(List<CssToken> tokens, int start) {
		int i = skipTrivia(tokens, start);
		CssToken open = tokenAt(tokens, i);
		if (!open.isType(CssTokenType.START_BLOCK)) {
			return ReadResult.failure(i, error("Expected '{' but found " + open.type(), open));
		}

		List<DeclarationRead> declarations = new ArrayList<>();
		List<RuleRead> rules = new ArrayList<>();
		List<AtRuleRead> atRules = new ArrayList<>();
		List<Diagnostic> errors = new ArrayList<>();

		i = skipTrivia(tokens, i + 1);
		while (true) {
			CssToken token = tokenAt(tokens, i);
			if (token.isType(CssTokenType.END_BLOCK)) {
				i++;
				break;
			}
			if (token.isType(CssTokenType.EOF)) {
				errors.add(error("Unclosed block", open));
				break;
			}
			if (token.isType(CssTokenType.SEMICOLON)) {
				i = skipTrivia(tokens, i + 1);
				continue;
			}

			int before = i;
			if (token.isType(CssTokenType.PROPERTY)) {
				ReadResult<DeclarationRead> declaration = readDeclaration(tokens, i);
				errors.addAll(declaration.errors());
				if (declaration.value() != null) {
					declarations.add(declaration.value());
				}
				i = declaration.endIndex();
			} else if (token.isType(CssTokenType.AT_KEYWORD)) {
				ReadResult<AtRuleRead> atRule = readAtRule(tokens, i);
				errors.addAll(atRule.errors());
				if (atRule.value() != null) {
					atRules.add(atRule.value());
				}
				i = atRule.endIndex();
			} else if (token.isSelector()) {
				ReadResult<RuleRead> rule = readRule(tokens, i);
				errors.addAll(rule.errors());
				if (rule.value() != null) {
					rules.add(rule.value());
				}
				i = rule.endIndex();
			} else {
				errors.add(error("Unexpected " + token.type() + " in block", token));
			}
			if (i == before) {
				i = resync(tokens, i);
			}
			i = skipTrivia(tokens, i);
		}

		return ReadResult.partial(new BlockRead(declarations, rules, atRules), i, errors);
	}

	/**
	 * Skips a block by counting nesting levels, without interpreting its
	 * contents. The end index points past the matching closing brace, or at
	 * EOF if the block is never closed.
	 */
	public static ReadResult<Integer> skipBlock(List<CssToken> tokens, int start) {
		int i = skipTrivia(tokens, start);
		CssToken open = tokenAt(tokens, i);
		if (!open.isType(CssTokenType.START_BLOCK)) {
			return ReadResult.failure(i, error("Expected '{' but found " + open.type(), open));
		}
		int level = 0;
		int skipped = 0;
		while (true) {
			CssToken token = tokenAt(tokens, i);
			if (token.isType(CssTokenType.EOF)) {
				return ReadResult.partial(skipped, i, List.of(error("Unclosed block", open)));
			}
			if (token.isType(CssTokenType.START_BLOCK)) {
				level++;
			} else if (token.isType(CssTokenType.END_BLOCK)) {
				level--;
				if (level == 0) {
					return ReadResult.success(skipped, i + 1);
				}
			}
			skipped++;
			i++;
		}
	}

	/**
	 * Reads the top level of a stylesheet.
	 */
	public static ReadResult<StylesheetOutline> readStylesheet(List<CssToken> tokens) {
		List<RuleRead> rules = new ArrayList<>();
		List<AtRuleRead> atRules = new ArrayList<>();
		List<Diagnostic> errors = new ArrayList<>();

		int i = skipTrivia(tokens, 0);
		while (!tokenAt(tokens, i).isType(CssTokenType.EOF)) {
			CssToken token = tokenAt(tokens, i);
			int before = i;
			if (token.isType(CssTokenType.AT_KEYWORD)) {
				ReadResult<AtRuleRead> atRule = readAtRule(tokens, i);
				errors.addAll(atRule.errors());
				if (atRule.value() != null) {
					atRules.add(atRule.value());
				}
				i = atRule.endIndex();
			} else if (token.isSelector()) {
				ReadResult<RuleRead> rule = readRule(tokens, i);
				errors.addAll(rule.errors());
				if (rule.value() != null) {
					rules.add(rule.value());
				}
				i = rule.endIndex();
			} else {
				errors.add(error("Unexpected " + token.type() + " at top level", token));
			}
			if (i == before) {
				i = resync(tokens, i);
			}
			i = skipTrivia(tokens, i);
		}

		return ReadResult.partial(new StylesheetOutline(rules, atRules), i, errors);
	}

	// ---- helpers ----

	/**
	 * Advances past the next semicolon or balanced block, whichever comes
	 * first. A closing brace is left in place for the enclosing block.
	 */
	private static int resync(List<CssToken> tokens, int from) {
		int i = from;
		while (true) {
			CssToken token = tokenAt(tokens, i);
			switch (token.type()) {
				case EOF -> {
					return i;
				}
				case SEMICOLON -> {
					return i + 1;
				}
				case END_BLOCK -> {
					return i == from ? i + 1 : i;
				}
				case START_BLOCK -> {
					return skipBlock(tokens, i).endIndex();
				}
				default -> i++;
			}
		}
	}

	private static boolean isSelectorArgument(CssToken token) {
		return switch (token.type()) {
			case OPEN_PAREN, CLOSE_PAREN, VALUE, NUMBER, STRING -> true;
			default -> false;
		};
	}

	private static int skipTrivia(List<CssToken> tokens, int from) {
		int i = from;
		while (i < tokens.size() - 1) {
			CssTokenType type = tokens.get(i).type();
			if (!type.isWhitespaceOrComment() && type != CssTokenType.ERROR) {
				break;
			}
			i++;
		}
		return i;
	}

	private static CssToken tokenAt(List<CssToken> tokens, int index) {
		if (tokens.isEmpty()) {
			throw new IllegalArgumentException("Token list must end with EOF");
		}
		return tokens.get(Math.min(index, tokens.size() - 1));
	}

	/**
	 * Joins selector tokens the way they were written. A space goes only where
	 * the source had whitespace, and always around a comma or combinator outside
	 * parentheses, so compound selectors such as {@code a::before} stay compound.
	 *
	 * @param parts selector tokens in source order
	 * @return the selector text
	 */
	public static String selectorText(List<CssToken> parts) {
		StringBuilder sb = new StringBuilder();
		CssToken previous = null;
		int depth = 0;
		for (CssToken part : parts) {
			if (part.isType(CssTokenType.CLOSE_PAREN)) {
				depth = Math.max(0, depth - 1);
			}
			if (previous != null) {
				boolean separator = depth == 0 && (isSeparator(part) || isSeparator(previous));
				if (separator || part.start() > previous.end()) {
					sb.append(' ');
				}
			}
			sb.append(render(part));
			if (part.isType(CssTokenType.OPEN_PAREN)) {
				depth++;
			}
			previous = part;
		}
		return sb.toString();
	}

	private static boolean isSeparator(CssToken token) {
		return token.isType(CssTokenType.COMMA) || token.isType(CssTokenType.COMBINATOR);
	}

	private static String joinAsWritten(List<CssToken> parts) {
		StringBuilder sb = new StringBuilder();
		CssToken previous = null;
		for (CssToken part : parts) {
			if (previous != null && part.start() > previous.end()) {
				sb.append(' ');
			}
			sb.append(render(part));
			previous = part;
		}
		return sb.toString();
	}

	private static String render(CssToken token) {
		return token.isType(CssTokenType.STRING) ? "\"" + token.value() + "\"" : token.value();
	}

	private static Diagnostic error(String message, CssToken at) {
		return Diagnostic.error(DiagnosticCategory.STRUCTURAL, message, at.line(), at.column(), at.start(), at.end());
	}
}
