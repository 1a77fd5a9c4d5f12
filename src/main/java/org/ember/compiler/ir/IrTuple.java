package org.ember.compiler.ir;

import java.util.List;

/**
 * A tuple.
 */
public record IrTuple(IrAnno anno, List<IrExpr> elements) implements IrExpr {
    public IrTuple {
        elements = List.copyOf(elements);
    }
}
