package org.ember.compiler.frontend.ast;

/**
 * A float literal.
 *
 * @param value The float value.
 */
public record FloatLiteral(double value) implements Literal {}
