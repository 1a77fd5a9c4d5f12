package org.ember.compiler.ir;

/**
 * The {@code Mod:fun} target of a remote call.
 */
public record IrRemote(IrAnno anno, IrExpr module, IrExpr function) implements IrExpr {}
