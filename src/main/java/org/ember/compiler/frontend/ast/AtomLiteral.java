package org.ember.compiler.frontend.ast;

/**
 * An atom literal. Booleans and {@code nil} are atoms, and so are module names.
 *
 * @param value The atom's text.
 */
public record AtomLiteral(String value) implements Literal {

    public static final AtomLiteral TRUE = new AtomLiteral("true");
    public static final AtomLiteral FALSE = new AtomLiteral("false");
    public static final AtomLiteral NIL = new AtomLiteral("nil");

    public static AtomLiteral of(String value) {
        return new AtomLiteral(value);
    }

    /**
     * @return {@code true} for every atom other than {@code false} and {@code nil}.
     */
    public boolean isTruthy() {
        return !FALSE.equals(this) && !NIL.equals(this);
    }
}
