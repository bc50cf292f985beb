package org.javai.csskit.reader;

import java.util.List;

/**
 * The contents of a {@code {...}} block, grouped by construct.
 */
public record BlockRead(List<DeclarationRead> declarations, List<RuleRead> rules, List<AtRuleRead> atRules) {

	public BlockRead {
		declarations = List.copyOf(declarations);
		rules = List.copyOf(rules);
		atRules = List.copyOf(atRules);
	}

	public boolean isEmpty() {
		return declarations.isEmpty() && rules.isEmpty() && atRules.isEmpty();
	}
}
