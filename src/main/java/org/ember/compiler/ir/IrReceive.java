package org.ember.compiler.ir;

import java.util.List;

/**
 * A receive expression. {@code timeout} is {@code null} when there is no {@code after} arm, in which
 * case {@code after} is empty.
 */
public record IrReceive(IrAnno anno, List<IrClause> clauses, IrExpr timeout, List<IrExpr> after) implements IrExpr {
    public IrReceive {
        clauses = List.copyOf(clauses);
        after = List.copyOf(after);
    }
}
