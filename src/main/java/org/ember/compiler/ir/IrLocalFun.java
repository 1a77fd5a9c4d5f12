package org.ember.compiler.ir;

/**
 * A reference to a function of the current module, {@code fun name/arity}.
 */
public record IrLocalFun(IrAnno anno, String name, int arity) implements IrExpr {}
