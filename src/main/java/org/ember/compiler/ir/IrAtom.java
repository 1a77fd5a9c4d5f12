package org.ember.compiler.ir;

/**
 * An atom literal.
 */
public record IrAtom(IrAnno anno, String value) implements IrExpr {}
