package org.ember.compiler.ir;

import java.util.List;

/**
 * A case expression.
 */
public record IrCase(IrAnno anno, IrExpr expr, List<IrClause> clauses) implements IrExpr {
    public IrCase {
        clauses = List.copyOf(clauses);
    }
}
