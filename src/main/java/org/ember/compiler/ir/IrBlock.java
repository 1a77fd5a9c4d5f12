package org.ember.compiler.ir;

import java.util.List;

/**
 * A sequence of expressions evaluating to the last one.
 */
public record IrBlock(IrAnno anno, List<IrExpr> exprs) implements IrExpr {
    public IrBlock {
        exprs = List.copyOf(exprs);
    }

    /**
     * @param expr A lowered expression.
     * @return The expressions of a block, or the expression itself as a one-element sequence.
     */
    public static List<IrExpr> unblock(IrExpr expr) {
        return expr instanceof IrBlock block ? block.exprs() : List.of(expr);
    }
}
