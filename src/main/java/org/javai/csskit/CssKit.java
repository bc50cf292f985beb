package org.javai.csskit;

import java.util.List;
import org.javai.csskit.ast.CssAst;
import org.javai.csskit.ast.CssNode;
import org.javai.csskit.automaton.AstMinimizer;
import org.javai.csskit.automaton.Automaton;
import org.javai.csskit.automaton.AutomatonState;
import org.javai.csskit.automaton.MinimizationResult;
import org.javai.csskit.automaton.StateMachineMinimizer;
import org.javai.csskit.automaton.TokenMinimizer;
import org.javai.csskit.config.CssKitConfig;
import org.javai.csskit.config.CssKitConfigParser;
import org.javai.csskit.parser.CssParser;
import org.javai.csskit.parser.ParseResult;
import org.javai.csskit.reader.ReadResult;
import org.javai.csskit.reader.StructuralReader;
import org.javai.csskit.reader.StylesheetOutline;
import org.javai.csskit.token.AutomatonToken;
import org.javai.csskit.tokenizer.CssTokenizer;
import org.javai.csskit.tokenizer.TokenizerResult;

/**
 * Entry point bundling the pipeline under one configuration.
 */
public class CssKit {

	private final CssKitConfig config;

	public CssKit() {
		this(CssKitConfig.defaults());
	}

	public CssKit(CssKitConfig config) {
		this.config = config != null ? config : CssKitConfig.defaults();
	}

	/**
	 * A kit configured from the bundled {@code META-INF/csskit-defaults.yml}.
	 */
	public static CssKit withBundledDefaults() {
		return new CssKit(new CssKitConfigParser().loadDefaults());
	}

	public CssKitConfig getConfig() {
		return config;
	}

	public TokenizerResult tokenize(String source) {
		return new CssTokenizer(source, config.tokenizer()).tokenize();
	}

	public ParseResult parse(String source) {
		return new CssParser(config.parser()).parse(source);
	}

	public MinimizationResult<AutomatonState> minimize(Automaton automaton) {
		return new StateMachineMinimizer(config.minimizer()).minimize(automaton);
	}

	/**
	 * Computes node equivalence classes and attaches the node metrics to the AST.
	 */
	public MinimizationResult<CssNode> minimize(CssAst ast) {
		return new AstMinimizer(config.minimizer()).minimize(ast);
	}

	/**
	 * Tokenizes the source and stamps every meaningful token with its transition
	 * and equivalence class.
	 */
	public List<AutomatonToken> minimizeTokens(String source) {
		return new TokenMinimizer().annotate(tokenize(source).tokens());
	}

	/**
	 * Reads the rule and at-rule outline of a stylesheet without building a tree.
	 */
	public ReadResult<StylesheetOutline> outline(String source) {
		return StructuralReader.readStylesheet(tokenize(source).tokens());
	}
}
