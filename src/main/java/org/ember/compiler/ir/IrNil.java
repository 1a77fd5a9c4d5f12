package org.ember.compiler.ir;

/**
 * The empty list.
 */
public record IrNil(IrAnno anno) implements IrExpr {}
