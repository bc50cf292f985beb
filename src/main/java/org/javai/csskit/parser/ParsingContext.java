package org.javai.csskit.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import org.javai.csskit.ast.CssNode;
import org.javai.csskit.ast.NodeData;
import org.javai.csskit.ast.NodeKind;
import org.javai.csskit.diagnostic.Diagnostic;
import org.javai.csskit.diagnostic.DiagnosticCategory;
import org.javai.csskit.reader.StructuralReader;
import org.javai.csskit.token.CssToken;
import org.javai.csskit.token.CssTokenType;

/**
 * Mutable state of one parse, handed to every {@link ParserState} handler.
 * <p>
 * The node stack holds the open containers: rules, keyframe blocks and
 * at-rules while their block or prelude is being read, and functions while
 * their arguments are being read. A declaration under construction is kept
 * aside and attached to the innermost container once it is complete.
 */
public final class ParsingContext {

	private final CssNode root = CssNode.stylesheet();
	private final Deque<CssNode> nodeStack = new ArrayDeque<>();
	private final Deque<int[]> functionParens = new ArrayDeque<>();
	private final List<CssToken> selectorParts = new ArrayList<>();
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private final ParserOptions options;
	private final Consumer<Diagnostic> listener;

	private CssNode currentDeclaration;
	private boolean expectingValue;
	private CssToken lastValueToken;
	private CssNode lastValueNode;
	private CssToken lastPreludeToken;
	private boolean awaitingFunctionParen;
	private int blockLevel;
	private boolean recovering;

	ParsingContext(ParserOptions options, Consumer<Diagnostic> listener) {
		this.options = options;
		this.listener = listener;
	}

	public CssNode getRoot() {
		return root;
	}

	public CssNode top() {
		return nodeStack.peek();
	}

	public int stackDepth() {
		return nodeStack.size();
	}

	public int getBlockLevel() {
		return blockLevel;
	}

	public boolean isInBlock() {
		return blockLevel > 0;
	}

	public boolean isExpectingValue() {
		return expectingValue;
	}

	public CssNode getCurrentDeclaration() {
		return currentDeclaration;
	}

	public List<Diagnostic> getDiagnostics() {
		return List.copyOf(diagnostics);
	}

	boolean isRecovering() {
		return recovering;
	}

	void setRecovering(boolean recovering) {
		this.recovering = recovering;
	}

	// ---- diagnostics ----

	void report(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
		if (listener != null) {
			listener.accept(diagnostic);
		}
	}

	void error(String message, CssToken at) {
		report(Diagnostic.error(DiagnosticCategory.SYNTACTIC, message, at.line(), at.column(), at.start(), at.end()));
	}

	void warning(String message, CssToken at) {
		report(Diagnostic.warning(DiagnosticCategory.SYNTACTIC, message, at.line(), at.column(), at.start(), at.end()));
	}

	// ---- at-rules ----

	void openAtRule(CssToken keyword) {
		String name = keyword.detail() != null ? keyword.detail() : keyword.value().substring(1);
		CssNode atRule = CssNode.atRule(name, "", false);
		nestedContainer().addChild(atRule);
		nodeStack.push(atRule);
		lastPreludeToken = null;
	}

	void appendPrelude(CssToken token) {
		CssNode atRule = top();
		if (atRule == null || !(atRule.getData() instanceof NodeData.AtRule data)) {
			return;
		}
		String text = token.isType(CssTokenType.STRING) ? "\"" + token.value() + "\"" : token.value();
		String prelude = data.prelude();
		if (!prelude.isEmpty() && lastPreludeToken != null && token.start() > lastPreludeToken.end()) {
			prelude += " ";
		}
		atRule.setData(new NodeData.AtRule(data.name(), prelude + text, data.hasBlock()));
		lastPreludeToken = token;
	}

	void openAtRuleBlock() {
		CssNode atRule = top();
		if (atRule != null && atRule.getData() instanceof NodeData.AtRule data) {
			atRule.setData(new NodeData.AtRule(data.name(), data.prelude(), true));
		}
		blockLevel++;
	}

	// ---- rules ----

	void beginSelector(CssToken token) {
		selectorParts.clear();
		selectorParts.add(token);
	}

	void appendSelector(CssToken token) {
		selectorParts.add(token);
	}

	String selectorText() {
		return StructuralReader.selectorText(selectorParts);
	}

	void openRule() {
		String selector = selectorText();
		selectorParts.clear();
		CssNode rule = insideKeyframes() ? CssNode.keyframeBlock(selector) : CssNode.rule(selector);
		nestedContainer().addChild(rule);
		nodeStack.push(rule);
		blockLevel++;
	}

	void discardSelector() {
		selectorParts.clear();
	}

	boolean hasSelector() {
		return !selectorParts.isEmpty();
	}

	/**
	 * Closes the innermost block: finalizes a pending declaration and pops the container.
	 */
	void closeBlock(CssToken token) {
		finishDeclaration(token);
		blockLevel = Math.max(0, blockLevel - 1);
		pop();
	}

	void pop() {
		CssNode popped = nodeStack.poll();
		if (popped != null && popped.isKind(NodeKind.FUNCTION)) {
			functionParens.poll();
		}
	}

	private boolean insideKeyframes() {
		CssNode container = top();
		return container != null && container.getData() instanceof NodeData.AtRule data
				&& data.name().toLowerCase(Locale.ROOT).endsWith("keyframes");
	}

	/**
	 * Where a new rule or at-rule goes: the enclosing at-rule when nesting is on, else the root.
	 */
	private CssNode nestedContainer() {
		CssNode container = top();
		if (options.parseNestedRules() && container != null && container.isKind(NodeKind.AT_RULE)) {
			return container;
		}
		return root;
	}

	/**
	 * Where a declaration or comment goes: the innermost rule-like node, else the root.
	 */
	CssNode blockContainer() {
		for (CssNode node : nodeStack) {
			if (node.isKind(NodeKind.RULE) || node.isKind(NodeKind.KEYFRAME_BLOCK) || node.isKind(NodeKind.AT_RULE)) {
				return node;
			}
		}
		return root;
	}

	// ---- declarations ----

	void beginDeclaration(CssToken property) {
		finishDeclaration(property);
		currentDeclaration = CssNode.declaration(false);
		currentDeclaration.addChild(CssNode.property(property.value()));
		expectingValue = false;
		lastValueToken = null;
		lastValueNode = null;
	}

	boolean startValue() {
		if (currentDeclaration == null || expectingValue) {
			return false;
		}
		expectingValue = true;
		return true;
	}

	boolean hasOpenDeclaration() {
		return currentDeclaration != null;
	}

	void markImportant() {
		currentDeclaration.setData(new NodeData.Declaration(true));
	}

	/**
	 * Adds a value to the innermost function, or to the declaration when no
	 * function is open. A unit directly after its number extends that value.
	 */
	void addValue(CssToken token) {
		CssNode target = top() != null && top().isKind(NodeKind.FUNCTION) ? top() : currentDeclaration;
		if (target == null) {
			return;
		}
		if (token.isType(CssTokenType.UNIT) && lastValueToken != null
				&& lastValueToken.isType(CssTokenType.NUMBER) && lastValueToken.end() == token.start()
				&& lastValueNode != null && lastValueNode.getParent() == target) {
			lastValueNode.setValue(lastValueNode.getValue() + token.value());
		} else {
			String text = token.isType(CssTokenType.STRING) ? "\"" + token.value() + "\"" : token.value();
			lastValueNode = CssNode.value(text);
			target.addChild(lastValueNode);
		}
		lastValueToken = token;
	}

	void openFunction(CssToken token) {
		CssNode function = CssNode.function(token.value());
		CssNode parent = top() != null && top().isKind(NodeKind.FUNCTION) ? top() : currentDeclaration;
		parent.addChild(function);
		nodeStack.push(function);
		functionParens.push(new int[] {0});
		awaitingFunctionParen = true;
		lastValueToken = token;
	}

	boolean inFunction() {
		return top() != null && top().isKind(NodeKind.FUNCTION);
	}

	/**
	 * Consumes an open paren inside function arguments: the function's own
	 * paren, or a grouping paren kept as a value.
	 */
	void openParen(CssToken token) {
		if (awaitingFunctionParen) {
			awaitingFunctionParen = false;
			return;
		}
		functionParens.peek()[0]++;
		addValue(token);
	}

	/**
	 * Consumes a close paren inside function arguments: closes a grouping
	 * paren, or the function itself.
	 */
	void closeParen(CssToken token) {
		int[] depth = functionParens.peek();
		if (depth != null && depth[0] > 0) {
			depth[0]--;
			addValue(token);
			return;
		}
		pop();
		lastValueToken = token;
	}

	/**
	 * Attaches the pending declaration if it is complete, otherwise drops it with a warning.
	 */
	void finishDeclaration(CssToken at) {
		if (currentDeclaration == null) {
			return;
		}
		CssNode declaration = currentDeclaration;
		String property = declaration.getPropertyName();
		while (inFunction()) {
			pop();
		}
		if (!expectingValue) {
			warning("Declaration '" + property + "' is missing ':'", at);
		} else if (declaration.getChildren().size() < 2) {
			warning("Declaration '" + property + "' has no value", at);
		} else {
			blockContainer().addChild(declaration);
		}
		resetDeclaration();
	}

	/**
	 * Drops any pending declaration and the functions opened inside it.
	 */
	void resetDeclaration() {
		while (inFunction()) {
			pop();
		}
		currentDeclaration = null;
		expectingValue = false;
		lastValueToken = null;
		lastValueNode = null;
		awaitingFunctionParen = false;
	}

	// ---- comments ----

	void addComment(CssToken token) {
		blockContainer().addChild(CssNode.comment(token.value()));
	}

	// ---- recovery ----

	/**
	 * Resynchronizes at a semicolon, closing brace or end of input: drops the
	 * partial declaration and selector and, at a closing brace, closes the
	 * innermost block.
	 */
	void resync(CssToken token) {
		resetDeclaration();
		selectorParts.clear();
		if (token.isType(CssTokenType.END_BLOCK)) {
			blockLevel = Math.max(0, blockLevel - 1);
			pop();
		}
		recovering = false;
	}

	/**
	 * The state that matches the innermost open container.
	 */
	ParserState anchorState() {
		CssNode node = top();
		if (node == null) {
			return ParserState.INITIAL;
		}
		return switch (node.getKind()) {
			case RULE, KEYFRAME_BLOCK -> ParserState.RULE_BLOCK;
			case AT_RULE -> node.getData() instanceof NodeData.AtRule data && data.hasBlock()
					? ParserState.AT_RULE_BLOCK
					: ParserState.AT_RULE_PRELUDE;
			case FUNCTION -> ParserState.FUNCTION_ARGS;
			default -> ParserState.INITIAL;
		};
	}
}
