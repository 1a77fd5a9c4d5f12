package org.ember.compiler.ir;

/**
 * A reference to an exported function, {@code fun Mod:name/arity}.
 */
public record IrRemoteFun(IrAnno anno, IrExpr module, IrExpr function, IrExpr arity) implements IrExpr {}
