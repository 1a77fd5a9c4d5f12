package org.ember.compiler.ir;

/**
 * A match {@code pattern = expr}.
 */
public record IrMatch(IrAnno anno, IrExpr pattern, IrExpr expr) implements IrExpr {}
