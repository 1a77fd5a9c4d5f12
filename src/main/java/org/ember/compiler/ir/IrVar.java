package org.ember.compiler.ir;

/**
 * A variable, by its internal name. {@code _} is the discard pattern.
 */
public record IrVar(IrAnno anno, String name) implements IrExpr {}
