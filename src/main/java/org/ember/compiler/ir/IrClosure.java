package org.ember.compiler.ir;

import java.util.List;

/**
 * An anonymous function.
 */
public record IrClosure(IrAnno anno, List<IrClause> clauses) implements IrExpr {
    public IrClosure {
        clauses = List.copyOf(clauses);
    }
}
