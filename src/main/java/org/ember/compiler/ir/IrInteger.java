package org.ember.compiler.ir;

/**
 * An integer literal.
 */
public record IrInteger(IrAnno anno, long value) implements IrExpr {}
