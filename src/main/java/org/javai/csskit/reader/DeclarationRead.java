package org.javai.csskit.reader;

public record DeclarationRead(String property, ValueRead value) {
}
