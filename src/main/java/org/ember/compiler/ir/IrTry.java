package org.ember.compiler.ir;

import java.util.List;

/**
 * A try expression.
 *
 * @param anno          The annotation.
 * @param body          The protected expressions.
 * @param elseClauses   Clauses matched against the body's value when it does not raise.
 * @param catchClauses  Clauses matched against {@code {Kind, Reason, Stacktrace}}.
 * @param after         Expressions always evaluated last, possibly empty.
 */
public record IrTry(IrAnno anno, List<IrExpr> body, List<IrClause> elseClauses, List<IrClause> catchClauses,
                    List<IrExpr> after) implements IrExpr {
    public IrTry {
        body = List.copyOf(body);
        elseClauses = List.copyOf(elseClauses);
        catchClauses = List.copyOf(catchClauses);
        after = List.copyOf(after);
    }
}
