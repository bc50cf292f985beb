package org.javai.csskit.reader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.csskit.diagnostic.Diagnostic;
import org.javai.csskit.diagnostic.DiagnosticCategory;
import org.javai.csskit.token.CssToken;
import org.javai.csskit.tokenizer.CssTokenizer;
import org.javai.csskit.tokenizer.TokenizerOptions;
import org.junit.jupiter.api.Test;

class StructuralReaderTest {

	@Test
	void readSelectorStopsBeforeBrace() {
		List<CssToken> tokens = tokens(".x, .y { margin: 0; }");

		ReadResult<SelectorRead> result = StructuralReader.readSelector(tokens, 0);

		assertThat(result.success()).isTrue();
		assertThat(result.value().text()).isEqualTo(".x , .y");
		assertThat(result.value().parts()).hasSize(3);
		assertThat(result.endIndex()).isEqualTo(3);
	}

	@Test
	void readSelectorSkipsWhitespaceTokens() {
		TokenizerOptions keepWhitespace = TokenizerOptions.builder().preserveWhitespace(true).build();
		List<CssToken> tokens = new CssTokenizer("a  b {}", keepWhitespace).tokenize().tokens();

		ReadResult<SelectorRead> result = StructuralReader.readSelector(tokens, 0);

		assertThat(result.value().text()).isEqualTo("a b");
		assertThat(tokens.get(result.endIndex()).value()).isEqualTo("{");
	}

	@Test
	void readSelectorWithoutBlockIsPartial() {
		ReadResult<SelectorRead> result = StructuralReader.readSelector(tokens("a"), 0);

		assertThat(result.success()).isFalse();
		assertThat(result.value().text()).isEqualTo("a");
		assertThat(messages(result)).containsExactly("Expected '{' after selector");
	}

	@Test
	void readSelectorRejectsNonSelector() {
		List<CssToken> tokens = tokens("a{}");

		ReadResult<SelectorRead> result = StructuralReader.readSelector(tokens, 1);

		assertThat(result.success()).isFalse();
		assertThat(result.value()).isNull();
		assertThat(result.endIndex()).isEqualTo(1);
		assertThat(result.errors()).singleElement().satisfies(d -> {
			assertThat(d.category()).isEqualTo(DiagnosticCategory.STRUCTURAL);
			assertThat(d.message()).isEqualTo("Expected selector but found START_BLOCK");
		});
	}

	@Test
	void readDeclarationConsumesSemicolon() {
		List<CssToken> tokens = tokens("a{color: red !important;}");

		ReadResult<DeclarationRead> result = StructuralReader.readDeclaration(tokens, 2);

		assertThat(result.success()).isTrue();
		assertThat(result.value().property()).isEqualTo("color");
		assertThat(result.value().value().text()).isEqualTo("red");
		assertThat(result.value().value().important()).isTrue();
		assertThat(tokens.get(result.endIndex()).value()).isEqualTo("}");
	}

	@Test
	void readValueKeepsSourceSpacing() {
		List<CssToken> tokens = tokens("a{margin:0 auto;color:rgb(1,2,3)}");

		ReadResult<ValueRead> margin = StructuralReader.readValue(tokens, 4);
		ReadResult<ValueRead> color = StructuralReader.readValue(tokens, margin.endIndex() + 2);

		assertThat(margin.value().text()).isEqualTo("0 auto");
		assertThat(color.value().text()).isEqualTo("rgb(1,2,3)");
		assertThat(color.value().important()).isFalse();
	}

	@Test
	void readPropertyWithoutColon() {
		ReadResult<PropertyRead> result = StructuralReader.readProperty(tokens("a{color red}"), 2);

		assertThat(result.success()).isFalse();
		assertThat(result.value().name()).isEqualTo("color");
		assertThat(messages(result)).containsExactly("Expected ':' after property 'color'");
	}

	@Test
	void readValueReportsMissingValue() {
		ReadResult<ValueRead> result = StructuralReader.readValue(tokens("a{color:;}"), 4);

		assertThat(result.success()).isFalse();
		assertThat(messages(result)).containsExactly("Expected value");
	}

	@Test
	void readRuleWithNestedRule() {
		List<CssToken> tokens = tokens("a{color:red;b{margin:0}}");

		ReadResult<RuleRead> result = StructuralReader.readRule(tokens, 0);

		assertThat(result.success()).isTrue();
		RuleRead rule = result.value();
		assertThat(rule.selector().text()).isEqualTo("a");
		assertThat(rule.block().declarations()).extracting(DeclarationRead::property).containsExactly("color");
		assertThat(rule.block().rules()).singleElement()
				.satisfies(nested -> assertThat(nested.selector().text()).isEqualTo("b"));
		assertThat(result.endIndex()).isEqualTo(tokens.size() - 1);
	}

	@Test
	void readStatementAtRule() {
		ReadResult<AtRuleRead> result = StructuralReader.readAtRule(tokens("@import \"theme.css\";"), 0);

		assertThat(result.success()).isTrue();
		assertThat(result.value().name()).isEqualTo("import");
		assertThat(result.value().prelude()).isEqualTo("\"theme.css\"");
		assertThat(result.value().hasBlock()).isFalse();
		assertThat(result.endIndex()).isEqualTo(3);
	}

	@Test
	void readBlockAtRule() {
		ReadResult<AtRuleRead> result = StructuralReader.readAtRule(tokens("@media screen{a{color:red}}"), 0);

		assertThat(result.success()).isTrue();
		assertThat(result.value().prelude()).isEqualTo("screen");
		assertThat(result.value().hasBlock()).isTrue();
		assertThat(result.value().block().rules()).hasSize(1);
	}

	@Test
	void readAtRuleWithoutTerminator() {
		ReadResult<AtRuleRead> result = StructuralReader.readAtRule(tokens("@charset x"), 0);

		assertThat(result.success()).isFalse();
		assertThat(result.value().name()).isEqualTo("charset");
		assertThat(messages(result)).containsExactly("Expected ';' or '{' after @charset");
	}

	@Test
	void readBlockResynchronizesAfterUnexpectedToken() {
		List<CssToken> tokens = tokens("a{color:red;) }");

		ReadResult<BlockRead> result = StructuralReader.readBlock(tokens, 1);

		assertThat(result.value().declarations()).hasSize(1);
		assertThat(messages(result)).containsExactly("Unexpected CLOSE_PAREN in block");
		assertThat(result.endIndex()).isEqualTo(tokens.size() - 1);
	}

	@Test
	void readBlockReportsUnclosedBlock() {
		ReadResult<BlockRead> result = StructuralReader.readBlock(tokens("a{color:red;"), 1);

		assertThat(result.value().declarations()).hasSize(1);
		assertThat(messages(result)).containsExactly("Unclosed block");
	}

	@Test
	void skipBlockCountsNestingLevels() {
		List<CssToken> tokens = tokens("a{b{c:d}}e{}");

		ReadResult<Integer> result = StructuralReader.skipBlock(tokens, 1);

		assertThat(result.success()).isTrue();
		assertThat(result.value()).isEqualTo(7);
		assertThat(tokens.get(result.endIndex()).value()).isEqualTo("e");
	}

	@Test
	void skipBlockStopsAtEndOfInput() {
		List<CssToken> tokens = tokens("a{b{");

		ReadResult<Integer> result = StructuralReader.skipBlock(tokens, 1);

		assertThat(result.success()).isFalse();
		assertThat(result.endIndex()).isEqualTo(tokens.size() - 1);
		assertThat(messages(result)).containsExactly("Unclosed block");
	}

	@Test
	void readStylesheetOutline() {
		List<CssToken> tokens = tokens("@import \"a.css\"; a{color:red} @media print{b{margin:0}}");

		ReadResult<StylesheetOutline> result = StructuralReader.readStylesheet(tokens);

		assertThat(result.success()).isTrue();
		assertThat(result.value().rules()).hasSize(1);
		assertThat(result.value().atRules()).extracting(AtRuleRead::name).containsExactly("import", "media");
	}

	@Test
	void readStylesheetContinuesAfterStrayToken() {
		ReadResult<StylesheetOutline> result = StructuralReader.readStylesheet(tokens("a{color:red} ; b{}"));

		assertThat(result.value().rules()).extracting(rule -> rule.selector().text()).containsExactly("a", "b");
		assertThat(messages(result)).containsExactly("Unexpected SEMICOLON at top level");
	}

	@Test
	void readersNeverReadPastEof() {
		List<CssToken> tokens = tokens("a{");

		ReadResult<SelectorRead> result = StructuralReader.readSelector(tokens, 99);

		assertThat(result.success()).isFalse();
		assertThat(result.errors().get(0).message()).contains("EOF");
	}

	@Test
	void emptyTokenListIsRejected() {
		assertThatThrownBy(() -> StructuralReader.readStylesheet(List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private static List<CssToken> tokens(String source) {
		return new CssTokenizer(source).tokenize().tokens();
	}

	private static List<String> messages(ReadResult<?> result) {
		return result.errors().stream().map(Diagnostic::message).toList();
	}
}
