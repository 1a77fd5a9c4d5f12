package org.ember.compiler.ir;

import java.util.List;

/**
 * A clause of a closure, case, receive or try. {@code guards} is a disjunction of conjunctions.
 */
public record IrClause(IrAnno anno, List<IrExpr> patterns, List<List<IrExpr>> guards, List<IrExpr> body) {
    public IrClause {
        patterns = List.copyOf(patterns);
        guards = guards.stream().map(List::copyOf).toList();
        body = List.copyOf(body);
    }
}
