package org.ember.compiler.frontend.ast;

/**
 * A string (binary) literal.
 *
 * @param value The string contents.
 */
public record StringLiteral(String value) implements Literal {}
