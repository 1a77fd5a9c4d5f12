package org.ember.compiler.ir;

/**
 * A character string, only found as the payload of a binary element.
 */
public record IrString(IrAnno anno, String value) implements IrExpr {}
