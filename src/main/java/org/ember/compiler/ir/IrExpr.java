package org.ember.compiler.ir;

/**
 * Base type for expressions of the lowered form. Every expression carries an annotation with its
 * source line and whether the compiler generated it.
 */
public sealed interface IrExpr permits IrAtom, IrInteger, IrFloat, IrString, IrNil, IrVar, IrMatch, IrTuple,
        IrCons, IrMap, IrBlock, IrLocalFun, IrRemoteFun, IrClosure, IrCall, IrRemote, IrOp, IrCase, IrTry,
        IrReceive, IrBin, IrComprehension {

    IrAnno anno();
}
