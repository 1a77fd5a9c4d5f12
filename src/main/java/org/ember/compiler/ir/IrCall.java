package org.ember.compiler.ir;

import java.util.List;

/**
 * A call. The target is an {@link IrAtom} for local calls, an {@link IrRemote} for remote calls and
 * any other expression for calls through a function value.
 */
public record IrCall(IrAnno anno, IrExpr target, List<IrExpr> args) implements IrExpr {
    public IrCall {
        args = List.copyOf(args);
    }
}
