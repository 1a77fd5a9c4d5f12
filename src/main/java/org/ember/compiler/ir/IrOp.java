package org.ember.compiler.ir;

import java.util.List;

/**
 * A built-in operator application, unary or binary.
 */
public record IrOp(IrAnno anno, String op, List<IrExpr> operands) implements IrExpr {
    public IrOp {
        operands = List.copyOf(operands);
    }
}
