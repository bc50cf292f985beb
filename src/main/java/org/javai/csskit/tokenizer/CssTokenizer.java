package org.javai.csskit.tokenizer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.csskit.diagnostic.Diagnostic;
import org.javai.csskit.diagnostic.DiagnosticCategory;
import org.javai.csskit.token.CssToken;
import org.javai.csskit.token.CssTokenBuilder;
import org.javai.csskit.token.CssTokenType;
import org.javai.csskit.token.TokenPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shift-reduce tokenizer for stylesheet source.
 * <p>
 * Characters are shifted into a buffer one at a time. After every shift the
 * buffer is offered to the token patterns in priority order; a pattern reduces
 * the buffer only once it is complete, which it decides by peeking at the next
 * unread character, so every token is as long as it can be. When no pattern
 * reduces and the buffer cannot grow into one, the buffer is flushed as a bare
 * identifier or reported as a lexical error.
 * <p>
 * Comments, quoted strings, {@code url(...)} and whitespace runs have bodies of
 * unbounded length. They are read in one pass by a character loop as soon as
 * they start, and never enter the pattern-driven buffer.
 * <p>
 * Lexical problems never abort the run: they are collected as diagnostics and
 * an ERROR token is emitted in place of the offending text. The token list
 * always ends with EOF.
 * <p>
 * An instance tokenizes one input; {@link #tokenize()} may be called again and
 * yields an identical result.
 */
public class CssTokenizer {

	private static final Logger logger = LoggerFactory.getLogger(CssTokenizer.class);

	private static final Pattern AT_KEYWORD = Pattern.compile("@-?[A-Za-z_][A-Za-z0-9_-]*");
	private static final Pattern FUNCTION_HEAD = Pattern.compile("(-{0,2}[A-Za-z_][A-Za-z0-9_-]*)\\(");
	private static final Pattern HASH_WORD = Pattern.compile("#[A-Za-z0-9_-]+");
	private static final Pattern HEX_DIGITS = Pattern.compile("#[0-9A-Fa-f]+");
	private static final Pattern IDENTIFIER = Pattern.compile("-{0,2}[A-Za-z_][A-Za-z0-9_-]*");
	private static final Pattern CLASS_NAME = Pattern.compile("\\.-?[A-Za-z_][A-Za-z0-9_-]*");
	private static final Pattern PSEUDO_CLASS = Pattern.compile(":-?[A-Za-z_][A-Za-z0-9_-]*");
	private static final Pattern PSEUDO_ELEMENT = Pattern.compile("::-?[A-Za-z_][A-Za-z0-9_-]*");
	private static final Pattern ATTRIBUTE = Pattern.compile("\\[[^\\]]*\\]");
	private static final Pattern SELECTOR_WORD = Pattern.compile("-?[A-Za-z0-9_][A-Za-z0-9_%-]*");
	private static final Pattern NUMBER = Pattern.compile("([+-]?(?:\\d*\\.\\d+|\\d+))([A-Za-z]+|%)?");
	private static final Pattern IMPORTANT = Pattern.compile("(?i)!important");

	/** Patterns consulted when deciding whether the buffer may still grow into a token. */
	private static final List<Pattern> PREFIX_PATTERNS = List.of(
			AT_KEYWORD, FUNCTION_HEAD, HASH_WORD, IDENTIFIER, CLASS_NAME,
			PSEUDO_CLASS, PSEUDO_ELEMENT, ATTRIBUTE, SELECTOR_WORD, NUMBER, IMPORTANT);

	private static final String STRUCTURAL_CHARS = "{}:;,()";
	private static final String VALUE_OPERATORS = "/*=<>";

	private final String input;
	private final TokenizerOptions options;

	private CssTokenBuilder builder;
	private List<CssToken> tokens;
	private List<Diagnostic> diagnostics;
	private final StringBuilder buffer = new StringBuilder();
	private final Deque<CssToken> bracketStack = new ArrayDeque<>();
	private int pos;
	private int line;
	private int column;
	private int bufferStart;
	private int bufferLine;
	private int bufferColumn;
	private int parenDepth;
	private CssToken lastMeaningful;
	private boolean inDeclarationValue;
	private boolean inAtRulePrelude;
	private boolean inSelector;
	private int lookaheadTokenId = -1;
	private boolean lookaheadResult;

	public CssTokenizer(String input) {
		this(input, TokenizerOptions.defaults());
	}

	public CssTokenizer(String input, TokenizerOptions options) {
		this.input = input != null ? input : "";
		this.options = options != null ? options : TokenizerOptions.defaults();
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return the tokens, always terminated by EOF, and any lexical diagnostics
	 */
	public TokenizerResult tokenize() {
		reset();

		while (pos < input.length() || buffer.length() > 0) {
			if (buffer.length() == 0 && readLiteral()) {
				continue;
			}
			if (buffer.length() > 0 && reduce()) {
				buffer.setLength(0);
				continue;
			}
			if (pos < input.length() && (buffer.length() == 0 || isViablePrefix(buffer.toString(), peek()))) {
				shift();
				continue;
			}
			flush();
		}

		Iterator<CssToken> unclosed = bracketStack.descendingIterator();
		while (unclosed.hasNext()) {
			CssToken open = unclosed.next();
			diagnostics.add(Diagnostic.error(DiagnosticCategory.LEXICAL, "Unclosed block",
					open.line(), open.column(), open.start(), open.end()));
		}

		tokens.add(builder.eof(new TokenPosition(line, column, pos, pos)));
		logger.debug("Tokenized {} characters into {} tokens with {} diagnostics",
				input.length(), tokens.size(), diagnostics.size());
		return new TokenizerResult(tokens, diagnostics);
	}

	private void reset() {
		builder = new CssTokenBuilder();
		tokens = new ArrayList<>();
		diagnostics = new ArrayList<>();
		buffer.setLength(0);
		bracketStack.clear();
		pos = 0;
		line = 1;
		column = 1;
		parenDepth = 0;
		lastMeaningful = null;
		inDeclarationValue = false;
		inAtRulePrelude = false;
		inSelector = false;
		lookaheadTokenId = -1;
	}

	// ---- shift / flush ----

	private void shift() {
		if (buffer.length() == 0) {
			bufferStart = pos;
			bufferLine = line;
			bufferColumn = column;
		}
		char c = input.charAt(pos++);
		buffer.append(c);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
	}

	private char peek() {
		return pos < input.length() ? input.charAt(pos) : '\0';
	}

	private void shiftTo(int end) {
		while (pos < end) {
			shift();
		}
	}

	private String takeBuffer() {
		String text = buffer.toString();
		buffer.setLength(0);
		return text;
	}

	/**
	 * Reads a comment, quoted string, {@code url(...)} or whitespace run starting
	 * at the current position.
	 *
	 * @return false when none starts here
	 */
	private boolean readLiteral() {
		char c = input.charAt(pos);
		if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '*') {
			readComment();
		} else if (c == '"' || c == '\'') {
			readString(c);
		} else if (options.recognizeFunctions() && input.regionMatches(true, pos, "url(", 0, 4)) {
			readUrl();
		} else if (Character.isWhitespace(c)) {
			readWhitespace();
		} else {
			return false;
		}
		return true;
	}

	private void readComment() {
		int close = input.indexOf("*/", pos + 2);
		shiftTo(close < 0 ? input.length() : close + 2);
		String text = takeBuffer();
		if (close < 0) {
			lexicalError("Unterminated comment", text);
		} else if (options.preserveComments()) {
			emit(CssTokenType.COMMENT, text.substring(2, text.length() - 2).trim(), 0, text.length());
		}
	}

	private void readString(char quote) {
		int i = pos + 1;
		boolean closed = false;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\' && i + 1 < input.length()) {
				i += 2;
				continue;
			}
			if (c == '\n') {
				break;
			}
			i++;
			if (c == quote) {
				closed = true;
				break;
			}
		}
		shiftTo(i);
		String text = takeBuffer();
		if (closed) {
			emit(CssTokenType.STRING, unescape(text.substring(1, text.length() - 1)), 0, text.length());
		} else {
			lexicalError("Unterminated string", text);
		}
	}

	private void readUrl() {
		int close = input.indexOf(')', pos + 4);
		shiftTo(close < 0 ? input.length() : close + 1);
		String text = takeBuffer();
		if (close < 0) {
			lexicalError("Unterminated url", text);
		} else {
			emit(CssTokenType.URL, text, 0, text.length());
		}
	}

	private void readWhitespace() {
		int i = pos;
		while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
			i++;
		}
		shiftTo(i);
		String text = takeBuffer();
		if (options.preserveWhitespace()) {
			emit(CssTokenType.WHITESPACE, text, 0, text.length());
		}
	}

	private boolean isViablePrefix(String text, char next) {
		String extended = text + next;
		for (Pattern pattern : PREFIX_PATTERNS) {
			Matcher matcher = pattern.matcher(extended);
			if (matcher.matches() || matcher.hitEnd()) {
				return true;
			}
		}
		return false;
	}

	private void flush() {
		String text = buffer.toString();
		buffer.setLength(0);
		if (text.charAt(0) == '[') {
			lexicalError("Unterminated attribute selector", text);
		} else if (IDENTIFIER.matcher(text).matches()) {
			emit(isPropertyContext() ? CssTokenType.PROPERTY : CssTokenType.VALUE, text, 0, text.length());
		} else {
			lexicalError("Unexpected input '" + text + "'", text);
		}
	}

	private void lexicalError(String message, String text) {
		diagnostics.add(Diagnostic.error(DiagnosticCategory.LEXICAL, message,
				bufferLine, bufferColumn, bufferStart, bufferStart + text.length()));
		emit(CssTokenType.ERROR, text, 0, text.length());
	}

	// ---- reductions, in priority order ----

	private boolean reduce() {
		String text = buffer.toString();
		char next = peek();
		return reduceAtKeyword(text, next)
				|| reduceFunction(text, next)
				|| reduceColor(text, next)
				|| reduceStructural(text, next)
				|| reduceSelector(text, next)
				|| reduceProperty(text, next)
				|| reduceNumber(text, next)
				|| reduceImportant(text, next)
				|| reduceOperator(text, next)
				|| reduceIdentifier(text, next);
	}

	private boolean reduceAtKeyword(String text, char next) {
		if (!AT_KEYWORD.matcher(text).matches() || isIdentChar(next)) {
			return false;
		}
		emit(CssTokenType.AT_KEYWORD, text, 0, text.length());
		inAtRulePrelude = true;
		return true;
	}

	private boolean reduceFunction(String text, char next) {
		if (!options.recognizeFunctions()) {
			return false;
		}
		Matcher head = FUNCTION_HEAD.matcher(text);
		if (!head.matches() || head.group(1).equalsIgnoreCase("url")) {
			return false;
		}
		String name = head.group(1);
		emit(CssTokenType.FUNCTION, name, 0, name.length());
		emit(CssTokenType.OPEN_PAREN, "(", name.length(), 1);
		parenDepth++;
		return true;
	}

	private boolean reduceColor(String text, char next) {
		if (!isValueContext() || !HASH_WORD.matcher(text).matches() || isIdentChar(next)) {
			return false;
		}
		if (!options.recognizeColors()) {
			emit(CssTokenType.VALUE, text, 0, text.length());
			return true;
		}
		int digits = text.length() - 1;
		if (HEX_DIGITS.matcher(text).matches() && (digits == 3 || digits == 4 || digits == 6 || digits == 8)) {
			emit(CssTokenType.COLOR, text, 0, text.length());
		} else {
			diagnostics.add(Diagnostic.error(DiagnosticCategory.LEXICAL, "Invalid hex color '" + text + "'",
					bufferLine, bufferColumn, bufferStart, bufferStart + text.length()));
			emit(CssTokenType.ERROR, text, 0, text.length());
		}
		return true;
	}

	private boolean reduceStructural(String text, char next) {
		if (text.length() != 1 || STRUCTURAL_CHARS.indexOf(text.charAt(0)) < 0) {
			return false;
		}
		switch (text.charAt(0)) {
			case '{' -> {
				CssToken open = emit(CssTokenType.START_BLOCK, "{", 0, 1);
				bracketStack.push(open);
				endStatement();
			}
			case '}' -> {
				if (bracketStack.isEmpty()) {
					diagnostics.add(Diagnostic.error(DiagnosticCategory.LEXICAL, "Unmatched closing brace",
							bufferLine, bufferColumn, bufferStart, bufferStart + 1));
					emit(CssTokenType.ERROR, "}", 0, 1);
				} else {
					bracketStack.pop();
					emit(CssTokenType.END_BLOCK, "}", 0, 1);
				}
				endStatement();
			}
			case ';' -> {
				emit(CssTokenType.SEMICOLON, ";", 0, 1);
				endStatement();
			}
			case ':' -> {
				if (isSelectorContext() && (isIdentStart(next) || next == ':')) {
					// pseudo-class or pseudo-element still being read
					return false;
				}
				boolean afterProperty = lastMeaningful != null && lastMeaningful.isType(CssTokenType.PROPERTY);
				emit(CssTokenType.COLON, ":", 0, 1);
				if (afterProperty) {
					inDeclarationValue = true;
				}
			}
			case ',' -> emit(CssTokenType.COMMA, ",", 0, 1);
			case '(' -> {
				emit(CssTokenType.OPEN_PAREN, "(", 0, 1);
				parenDepth++;
			}
			case ')' -> {
				emit(CssTokenType.CLOSE_PAREN, ")", 0, 1);
				parenDepth = Math.max(0, parenDepth - 1);
			}
			default -> {
				return false;
			}
		}
		return true;
	}

	private boolean reduceSelector(String text, char next) {
		if (!isSelectorContext()) {
			return false;
		}
		if (text.length() == 1 && ">+~".indexOf(text.charAt(0)) >= 0) {
			emit(CssTokenType.COMBINATOR, text, 0, 1);
			return true;
		}
		if (text.equals("*") || text.equals("&")) {
			emit(CssTokenType.SELECTOR, text, 0, 1);
			return true;
		}
		if (ATTRIBUTE.matcher(text).matches()) {
			emit(CssTokenType.ATTRIBUTE_SELECTOR, text, 0, text.length());
			return true;
		}
		if (isIdentChar(next)) {
			return false;
		}
		CssTokenType type;
		if (PSEUDO_ELEMENT.matcher(text).matches()) {
			type = CssTokenType.PSEUDO_ELEMENT;
		} else if (PSEUDO_CLASS.matcher(text).matches()) {
			type = CssTokenType.PSEUDO_CLASS;
		} else if (CLASS_NAME.matcher(text).matches()) {
			type = CssTokenType.CLASS_SELECTOR;
		} else if (HASH_WORD.matcher(text).matches()) {
			type = CssTokenType.ID_SELECTOR;
		} else if (SELECTOR_WORD.matcher(text).matches() && next != '%') {
			type = CssTokenType.ELEMENT_SELECTOR;
		} else {
			return false;
		}
		emit(type, text, 0, text.length());
		return true;
	}

	private boolean reduceProperty(String text, char next) {
		if (!isPropertyContext() || !isCompleteIdentifier(text, next)) {
			return false;
		}
		emit(CssTokenType.PROPERTY, text, 0, text.length());
		return true;
	}

	private boolean reduceNumber(String text, char next) {
		Matcher matcher = NUMBER.matcher(text);
		if (!matcher.matches() || Character.isLetterOrDigit(next) || next == '%' || next == '.') {
			return false;
		}
		String number = matcher.group(1);
		emit(CssTokenType.NUMBER, number, 0, number.length());
		String unit = matcher.group(2);
		if (unit != null) {
			emit(CssTokenType.UNIT, unit, number.length(), unit.length());
		}
		return true;
	}

	private boolean reduceImportant(String text, char next) {
		if (!IMPORTANT.matcher(text).matches() || isIdentChar(next)) {
			return false;
		}
		emit(CssTokenType.IMPORTANT_FLAG, text, 0, text.length());
		return true;
	}

	private boolean reduceOperator(String text, char next) {
		if (text.length() != 1 || !isValueContext()) {
			return false;
		}
		char c = text.charAt(0);
		boolean operator = (VALUE_OPERATORS.indexOf(c) >= 0 && !(c == '/' && next == '*'))
				|| ((c == '+' || c == '-') && (Character.isWhitespace(next) || next == '\0'));
		if (!operator) {
			return false;
		}
		emit(CssTokenType.VALUE, text, 0, 1);
		return true;
	}

	private boolean reduceIdentifier(String text, char next) {
		if (!isCompleteIdentifier(text, next)) {
			return false;
		}
		emit(CssTokenType.VALUE, text, 0, text.length());
		return true;
	}

	// ---- context ----

	private boolean isSelectorContext() {
		if (inDeclarationValue || inAtRulePrelude) {
			return false;
		}
		if (parenDepth > 0) {
			return inSelector;
		}
		if (lastMeaningful == null) {
			return true;
		}
		return switch (lastMeaningful.type()) {
			case COMMA, COMBINATOR -> true;
			case END_BLOCK, SEMICOLON -> bracketStack.isEmpty() || startsNestedRule();
			case START_BLOCK -> startsNestedRule();
			case CLOSE_PAREN -> inSelector;
			default -> lastMeaningful.isSelector();
		};
	}

	private boolean isPropertyContext() {
		if (inDeclarationValue || inAtRulePrelude || bracketStack.isEmpty() || parenDepth > 0 || lastMeaningful == null) {
			return false;
		}
		CssTokenType last = lastMeaningful.type();
		return (last == CssTokenType.START_BLOCK || last == CssTokenType.SEMICOLON || last == CssTokenType.END_BLOCK)
				&& !isSelectorContext();
	}

	private boolean isValueContext() {
		return inDeclarationValue || inAtRulePrelude || (parenDepth > 0 && !inSelector);
	}

	private void endStatement() {
		inDeclarationValue = false;
		inAtRulePrelude = false;
		inSelector = false;
		parenDepth = 0;
	}

	/**
	 * Inside a block, decides whether the statement following the last token is
	 * a nested rule: true when a {@code '{'} comes before the next {@code ';'} or
	 * {@code '}'}. Strings, comments and parenthesised text are skipped.
	 */
	private boolean startsNestedRule() {
		if (lookaheadTokenId == lastMeaningful.id()) {
			return lookaheadResult;
		}
		lookaheadTokenId = lastMeaningful.id();
		lookaheadResult = scanForBlockOpen(lastMeaningful.end());
		return lookaheadResult;
	}

	private boolean scanForBlockOpen(int from) {
		int depth = 0;
		int i = from;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '/' && i + 1 < input.length() && input.charAt(i + 1) == '*') {
				int close = input.indexOf("*/", i + 2);
				if (close < 0) {
					return false;
				}
				i = close + 2;
				continue;
			}
			if (c == '"' || c == '\'') {
				i = skipQuoted(i, c);
				continue;
			}
			switch (c) {
				case '(' -> depth++;
				case ')' -> depth = Math.max(0, depth - 1);
				case '{' -> {
					if (depth == 0) {
						return true;
					}
				}
				case ';', '}' -> {
					if (depth == 0) {
						return false;
					}
				}
				default -> {
				}
			}
			i++;
		}
		return false;
	}

	private int skipQuoted(int openIndex, char quote) {
		int i = openIndex + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (c == quote || c == '\n') {
				return i + 1;
			}
			i++;
		}
		return i;
	}

	// ---- helpers ----

	private CssToken emit(CssTokenType type, String value, int offset, int length) {
		int start = bufferStart + offset;
		TokenPosition position = new TokenPosition(bufferLine, bufferColumn + offset, start, start + length);
		CssToken token = builder.create(type, value, position);
		tokens.add(token);
		logger.trace("Reduced {}", token);
		if (!type.isWhitespaceOrComment() && type != CssTokenType.ERROR) {
			lastMeaningful = token;
		}
		if (type.isSelector()) {
			inSelector = true;
		}
		return token;
	}

	private boolean isCompleteIdentifier(String text, char next) {
		if (!IDENTIFIER.matcher(text).matches() || isIdentChar(next)) {
			return false;
		}
		return !(options.recognizeFunctions() && next == '(');
	}

	private static boolean isIdentStart(char c) {
		return Character.isLetter(c) || c == '_' || c == '-';
	}

	private static boolean isIdentChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '-';
	}

	private static String unescape(String body) {
		StringBuilder sb = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length()) {
				char escaped = body.charAt(++i);
				if (escaped != '\n') {
					sb.append(escaped);
				}
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}
}
