package org.ember.compiler.ir;

/**
 * A float literal.
 */
public record IrFloat(IrAnno anno, double value) implements IrExpr {}
