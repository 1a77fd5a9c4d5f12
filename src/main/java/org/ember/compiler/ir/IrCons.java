package org.ember.compiler.ir;

/**
 * A list cell.
 */
public record IrCons(IrAnno anno, IrExpr head, IrExpr tail) implements IrExpr {}
