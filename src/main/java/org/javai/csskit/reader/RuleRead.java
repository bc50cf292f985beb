package org.javai.csskit.reader;

public record RuleRead(SelectorRead selector, BlockRead block) {
}
