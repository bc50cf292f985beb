package org.javai.csskit.reader;

import java.util.List;

/**
 * Top-level rules and at-rules of a stylesheet, read without the state-machine parser.
 */
public record StylesheetOutline(List<RuleRead> rules, List<AtRuleRead> atRules) {

	public StylesheetOutline {
		rules = List.copyOf(rules);
		atRules = List.copyOf(atRules);
	}
}
