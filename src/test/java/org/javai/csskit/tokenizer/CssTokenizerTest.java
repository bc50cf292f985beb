package org.javai.csskit.tokenizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.javai.csskit.token.CssTokenType.AT_KEYWORD;
import static org.javai.csskit.token.CssTokenType.ATTRIBUTE_SELECTOR;
import static org.javai.csskit.token.CssTokenType.CLASS_SELECTOR;
import static org.javai.csskit.token.CssTokenType.CLOSE_PAREN;
import static org.javai.csskit.token.CssTokenType.COLON;
import static org.javai.csskit.token.CssTokenType.COLOR;
import static org.javai.csskit.token.CssTokenType.COMBINATOR;
import static org.javai.csskit.token.CssTokenType.COMMA;
import static org.javai.csskit.token.CssTokenType.COMMENT;
import static org.javai.csskit.token.CssTokenType.ELEMENT_SELECTOR;
import static org.javai.csskit.token.CssTokenType.END_BLOCK;
import static org.javai.csskit.token.CssTokenType.EOF;
import static org.javai.csskit.token.CssTokenType.ERROR;
import static org.javai.csskit.token.CssTokenType.FUNCTION;
import static org.javai.csskit.token.CssTokenType.ID_SELECTOR;
import static org.javai.csskit.token.CssTokenType.IMPORTANT_FLAG;
import static org.javai.csskit.token.CssTokenType.NUMBER;
import static org.javai.csskit.token.CssTokenType.OPEN_PAREN;
import static org.javai.csskit.token.CssTokenType.PROPERTY;
import static org.javai.csskit.token.CssTokenType.PSEUDO_CLASS;
import static org.javai.csskit.token.CssTokenType.PSEUDO_ELEMENT;
import static org.javai.csskit.token.CssTokenType.SELECTOR;
import static org.javai.csskit.token.CssTokenType.SEMICOLON;
import static org.javai.csskit.token.CssTokenType.START_BLOCK;
import static org.javai.csskit.token.CssTokenType.STRING;
import static org.javai.csskit.token.CssTokenType.UNIT;
import static org.javai.csskit.token.CssTokenType.URL;
import static org.javai.csskit.token.CssTokenType.VALUE;
import static org.javai.csskit.token.CssTokenType.WHITESPACE;

import java.time.Duration;
import java.util.List;
import org.javai.csskit.diagnostic.Diagnostic;
import org.javai.csskit.diagnostic.DiagnosticCategory;
import org.javai.csskit.token.CssToken;
import org.javai.csskit.token.CssTokenType;
import org.junit.jupiter.api.Test;

class CssTokenizerTest {

	@Test
	void tokenizeEmptyInput() {
		TokenizerResult result = new CssTokenizer("").tokenize();

		assertThat(result.tokens()).hasSize(1);
		assertThat(result.tokens().get(0).type()).isEqualTo(EOF);
		assertThat(result.isClean()).isTrue();
	}

	@Test
	void tokenizeNullInput() {
		TokenizerResult result = new CssTokenizer(null).tokenize();

		assertThat(types(result)).containsExactly(EOF);
	}

	@Test
	void tokenizeSimpleRule() {
		TokenizerResult result = new CssTokenizer("a{color:red;}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, VALUE, SEMICOLON, END_BLOCK, EOF);
		assertThat(values(result)).containsExactly("a", "{", "color", ":", "red", ";", "}", "");
		assertThat(result.diagnostics()).isEmpty();
	}

	@Test
	void positionsTrackOffsetsAndColumns() {
		List<CssToken> tokens = new CssTokenizer("a { color: red; }").tokenize().tokens();

		assertPosition(tokens.get(0), 1, 1, 0, 1);
		assertPosition(tokens.get(1), 1, 3, 2, 3);
		assertPosition(tokens.get(2), 1, 5, 4, 9);
		assertPosition(tokens.get(3), 1, 10, 9, 10);
		assertPosition(tokens.get(4), 1, 12, 11, 14);
		assertPosition(tokens.get(5), 1, 15, 14, 15);
		assertPosition(tokens.get(6), 1, 17, 16, 17);
		assertPosition(tokens.get(7), 1, 18, 17, 17);
	}

	@Test
	void positionsTrackLines() {
		List<CssToken> tokens = new CssTokenizer("a{\n  color: red;\n}").tokenize().tokens();

		assertPosition(tokens.get(2), 2, 3, 5, 10);
		assertPosition(tokens.get(6), 3, 1, 17, 18);
	}

	@Test
	void selectorListWithClasses() {
		TokenizerResult result = new CssTokenizer(".x, .y { margin: 0; }").tokenize();

		assertThat(types(result)).containsExactly(
				CLASS_SELECTOR, COMMA, CLASS_SELECTOR, START_BLOCK, PROPERTY, COLON, NUMBER, SEMICOLON, END_BLOCK, EOF);
	}

	@Test
	void compoundSelectors() {
		TokenizerResult result = new CssTokenizer("ul > li.item#main[data-x=\"1\"] * {}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, COMBINATOR, ELEMENT_SELECTOR, CLASS_SELECTOR, ID_SELECTOR, ATTRIBUTE_SELECTOR,
				SELECTOR, START_BLOCK, END_BLOCK, EOF);
		assertThat(values(result)).contains("li", ".item", "#main", "[data-x=\"1\"]", "*");
	}

	@Test
	void pseudoClassesAndElements() {
		TokenizerResult result = new CssTokenizer("a:hover::before{}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, PSEUDO_CLASS, PSEUDO_ELEMENT, START_BLOCK, END_BLOCK, EOF);
		assertThat(values(result)).startsWith("a", ":hover", "::before");
	}

	@Test
	void numberAndUnitAreSeparateAdjacentTokens() {
		List<CssToken> tokens = new CssTokenizer("a{width:10px}").tokenize().tokens();

		CssToken number = tokens.get(4);
		CssToken unit = tokens.get(5);
		assertThat(number.type()).isEqualTo(NUMBER);
		assertThat(number.value()).isEqualTo("10");
		assertThat(number.numericValue()).isEqualTo(10.0);
		assertThat(unit.type()).isEqualTo(UNIT);
		assertThat(unit.value()).isEqualTo("px");
		assertThat(unit.start()).isEqualTo(number.end());
	}

	@Test
	void percentageIsANumberWithUnit() {
		TokenizerResult result = new CssTokenizer("a{width:50%}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, NUMBER, UNIT, END_BLOCK, EOF);
		assertThat(result.tokens().get(5).value()).isEqualTo("%");
	}

	@Test
	void valueOperatorsAndDecimals() {
		TokenizerResult result = new CssTokenizer("a{font:12px/1.5 serif}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, NUMBER, UNIT, VALUE, NUMBER, VALUE, END_BLOCK, EOF);
		assertThat(result.tokens().get(7).numericValue()).isEqualTo(1.5);
	}

	@Test
	void hexColors() {
		TokenizerResult result = new CssTokenizer("a{color:#fff;background:#a1b2c3}").tokenize();

		assertThat(result.tokens()).filteredOn(t -> t.isType(COLOR))
				.extracting(CssToken::value)
				.containsExactly("#fff", "#a1b2c3");
		assertThat(result.isClean()).isTrue();
	}

	@Test
	void invalidHexColorIsALexicalError() {
		TokenizerResult result = new CssTokenizer("a{color:#abcde}").tokenize();

		assertThat(types(result)).contains(ERROR).doesNotContain(COLOR);
		assertThat(result.diagnostics()).singleElement().satisfies(d -> {
			assertThat(d.category()).isEqualTo(DiagnosticCategory.LEXICAL);
			assertThat(d.message()).isEqualTo("Invalid hex color '#abcde'");
		});
	}

	@Test
	void colorRecognitionCanBeSwitchedOff() {
		TokenizerOptions options = TokenizerOptions.builder().recognizeColors(false).build();
		TokenizerResult result = new CssTokenizer("a{color:#fff}", options).tokenize();

		assertThat(result.tokens().get(4).type()).isEqualTo(VALUE);
		assertThat(result.tokens().get(4).value()).isEqualTo("#fff");
	}

	@Test
	void functionsSplitIntoNameAndParen() {
		TokenizerResult result = new CssTokenizer("a{color:rgb(1, 2, 3)}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, FUNCTION, OPEN_PAREN, NUMBER, COMMA, NUMBER, COMMA,
				NUMBER, CLOSE_PAREN, END_BLOCK, EOF);
		assertThat(result.tokens().get(4).detail()).isEqualTo("rgb");
	}

	@Test
	void functionRecognitionCanBeSwitchedOff() {
		TokenizerOptions options = TokenizerOptions.builder().recognizeFunctions(false).build();
		TokenizerResult result = new CssTokenizer("a{color:rgb(1)}", options).tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, VALUE, OPEN_PAREN, NUMBER, CLOSE_PAREN, END_BLOCK, EOF);
	}

	@Test
	void urlIsOneToken() {
		TokenizerResult result = new CssTokenizer("a{background:url(img/bg.png)}").tokenize();

		CssToken url = result.tokens().get(4);
		assertThat(url.type()).isEqualTo(URL);
		assertThat(url.value()).isEqualTo("url(img/bg.png)");
		assertThat(url.detail()).isEqualTo("img/bg.png");
	}

	@Test
	void importantFlag() {
		TokenizerResult result = new CssTokenizer("a{color:red !important}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, VALUE, IMPORTANT_FLAG, END_BLOCK, EOF);
	}

	@Test
	void stringsAreUnescaped() {
		TokenizerResult result = new CssTokenizer("a{content:\"a\\\"b\"}").tokenize();

		CssToken string = result.tokens().get(4);
		assertThat(string.type()).isEqualTo(STRING);
		assertThat(string.value()).isEqualTo("a\"b");
		assertThat(string.position().length()).isEqualTo(6);
	}

	@Test
	void atRulePrelude() {
		TokenizerResult result = new CssTokenizer("@media screen and (min-width: 100px) {}").tokenize();

		assertThat(types(result)).containsExactly(
				AT_KEYWORD, VALUE, VALUE, OPEN_PAREN, VALUE, COLON, NUMBER, UNIT, CLOSE_PAREN, START_BLOCK, END_BLOCK,
				EOF);
		assertThat(result.tokens().get(0).detail()).isEqualTo("media");
	}

	@Test
	void nestedRuleIsToldApartFromDeclaration() {
		TokenizerResult result = new CssTokenizer("a{color:red;b{margin:0}}").tokenize();

		assertThat(types(result)).containsExactly(
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, VALUE, SEMICOLON,
				ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, NUMBER, END_BLOCK, END_BLOCK, EOF);
	}

	@Test
	void keyframeSelectors() {
		TokenizerResult result = new CssTokenizer("@keyframes spin{from{opacity:0}50%{opacity:1}}").tokenize();

		assertThat(result.tokens()).filteredOn(t -> t.isType(ELEMENT_SELECTOR))
				.extracting(CssToken::value)
				.containsExactly("from", "50%");
	}

	@Test
	void commentsAreKeptByDefault() {
		TokenizerResult result = new CssTokenizer("/* note */a{}").tokenize();

		assertThat(types(result)).containsExactly(COMMENT, ELEMENT_SELECTOR, START_BLOCK, END_BLOCK, EOF);
		assertThat(result.tokens().get(0).value()).isEqualTo("note");
	}

	@Test
	void commentsCanBeDropped() {
		TokenizerOptions options = TokenizerOptions.builder().preserveComments(false).build();
		TokenizerResult result = new CssTokenizer("/* note */a{}", options).tokenize();

		assertThat(types(result)).containsExactly(ELEMENT_SELECTOR, START_BLOCK, END_BLOCK, EOF);
	}

	@Test
	void whitespaceCanBeKept() {
		TokenizerOptions options = TokenizerOptions.defaults().toBuilder().preserveWhitespace(true).build();
		TokenizerResult result = new CssTokenizer("a  {}", options).tokenize();

		assertThat(types(result)).containsExactly(ELEMENT_SELECTOR, WHITESPACE, START_BLOCK, END_BLOCK, EOF);
		assertThat(result.tokens().get(1).value()).isEqualTo("  ");
	}

	@Test
	void unterminatedStringIsReported() {
		TokenizerResult result = new CssTokenizer("a{content:\"abc").tokenize();

		assertThat(messages(result)).contains("Unterminated string", "Unclosed block");
		assertThat(result.tokens().get(result.tokens().size() - 1).type()).isEqualTo(EOF);
	}

	@Test
	void unterminatedCommentIsReported() {
		TokenizerResult result = new CssTokenizer("a{} /* abc").tokenize();

		assertThat(messages(result)).containsExactly("Unterminated comment");
		assertThat(types(result)).containsExactly(ELEMENT_SELECTOR, START_BLOCK, END_BLOCK, ERROR, EOF);
	}

	@Test
	void longStringIsOneToken() {
		String body = "x".repeat(100_000);
		String input = "a{content:\"" + body + "\"}";

		TokenizerResult result = assertTimeout(Duration.ofSeconds(5), () -> new CssTokenizer(input).tokenize());

		assertThat(result.isClean()).isTrue();
		assertThat(types(result)).containsExactly(ELEMENT_SELECTOR, START_BLOCK, PROPERTY, COLON, STRING, END_BLOCK, EOF);
		CssToken string = result.tokens().get(4);
		assertThat(string.value()).hasSize(100_000);
		assertThat(string.end() - string.start()).isEqualTo(100_002);
	}

	@Test
	void longCommentIsOneToken() {
		String input = "/*" + "x".repeat(100_000) + "*/a{}";

		TokenizerResult result = assertTimeout(Duration.ofSeconds(5), () -> new CssTokenizer(input).tokenize());

		assertThat(result.isClean()).isTrue();
		assertThat(types(result)).containsExactly(COMMENT, ELEMENT_SELECTOR, START_BLOCK, END_BLOCK, EOF);
		assertThat(result.tokens().get(0).value()).hasSize(100_000);
	}

	@Test
	void stringStopsAtLineBreakUnlessEscaped() {
		TokenizerResult escaped = new CssTokenizer("a{content:'x\\\ny'}").tokenize();
		TokenizerResult broken = new CssTokenizer("a{content:'xy\n}").tokenize();

		assertThat(escaped.isClean()).isTrue();
		assertThat(escaped.tokens().get(4).value()).isEqualTo("xy");
		assertThat(escaped.tokens().get(5).line()).isEqualTo(2);
		assertThat(messages(broken)).contains("Unterminated string");
		assertThat(broken.diagnostics().get(0).end()).isEqualTo(13);
	}

	@Test
	void commentsKeepLineCount() {
		TokenizerResult result = new CssTokenizer("/* one\ntwo\n*/\na{}").tokenize();

		assertThat(result.tokens().get(1).line()).isEqualTo(4);
		assertThat(result.tokens().get(1).column()).isEqualTo(1);
	}

	@Test
	void unterminatedUrlIsReported() {
		TokenizerResult result = new CssTokenizer("a{background:url(x.png}").tokenize();

		assertThat(messages(result)).contains("Unterminated url");
	}

	@Test
	void unknownCharacterBecomesErrorTokenAndTokenizingContinues() {
		TokenizerResult result = new CssTokenizer("$ a{}").tokenize();

		assertThat(types(result)).containsExactly(ERROR, ELEMENT_SELECTOR, START_BLOCK, END_BLOCK, EOF);
		Diagnostic diagnostic = result.diagnostics().get(0);
		assertThat(diagnostic.message()).isEqualTo("Unexpected input '$'");
		assertThat(diagnostic.column()).isEqualTo(1);
		assertThat(result.hasErrors()).isTrue();
	}

	@Test
	void unmatchedClosingBrace() {
		TokenizerResult result = new CssTokenizer("a{}}").tokenize();

		assertThat(types(result)).containsExactly(ELEMENT_SELECTOR, START_BLOCK, END_BLOCK, ERROR, EOF);
		assertThat(messages(result)).containsExactly("Unmatched closing brace");
	}

	@Test
	void unclosedBlockIsReportedAtItsBrace() {
		TokenizerResult result = new CssTokenizer("a{").tokenize();

		assertThat(result.diagnostics()).singleElement().satisfies(d -> {
			assertThat(d.message()).isEqualTo("Unclosed block");
			assertThat(d.start()).isEqualTo(1);
		});
	}

	@Test
	void tokenizingTwiceGivesTheSameTokens() {
		CssTokenizer tokenizer = new CssTokenizer(".a > b:hover { color: #fff; margin: 0 auto; }");

		TokenizerResult first = tokenizer.tokenize();
		TokenizerResult second = tokenizer.tokenize();

		assertThat(second.tokens()).isEqualTo(first.tokens());
	}

	@Test
	void idsIncreaseThroughTheRun() {
		List<CssToken> tokens = new CssTokenizer("a{color:red}").tokenize().tokens();

		for (int i = 0; i < tokens.size(); i++) {
			assertThat(tokens.get(i).id()).isEqualTo(i);
		}
	}

	private static List<CssTokenType> types(TokenizerResult result) {
		return result.tokens().stream().map(CssToken::type).toList();
	}

	private static List<String> values(TokenizerResult result) {
		return result.tokens().stream().map(CssToken::value).toList();
	}

	private static List<String> messages(TokenizerResult result) {
		return result.diagnostics().stream().map(Diagnostic::message).toList();
	}

	@Test
	void spansCoverTheInputUpToWhitespace() {
		String input = "a { color: red; }\n.x, .y { margin: 10px auto; }\n@import \"t.css\";\n";

		List<CssToken> tokens = new CssTokenizer(input).tokenize().tokens();

		int offset = 0;
		for (CssToken token : tokens) {
			if (token.isType(EOF)) {
				break;
			}
			assertThat(input.substring(offset, token.start())).as("gap before %s", token).isBlank();
			assertThat(token.end()).isGreaterThan(token.start());
			offset = token.end();
		}
		assertThat(input.substring(offset)).isBlank();
	}

	private static void assertPosition(CssToken token, int line, int column, int start, int end) {
		assertThat(token.line()).as("line of %s", token).isEqualTo(line);
		assertThat(token.column()).as("column of %s", token).isEqualTo(column);
		assertThat(token.start()).as("start of %s", token).isEqualTo(start);
		assertThat(token.end()).as("end of %s", token).isEqualTo(end);
	}
}
