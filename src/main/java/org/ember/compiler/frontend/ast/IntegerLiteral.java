package org.ember.compiler.frontend.ast;

/**
 * An integer literal.
 *
 * @param value The integer value.
 */
public record IntegerLiteral(long value) implements Literal {

    public static IntegerLiteral of(long value) {
        return new IntegerLiteral(value);
    }
}
