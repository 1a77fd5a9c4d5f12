package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.WithNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrExpr;

/**
 * Lowers {@code with} expressions.
 */
public interface WithLowering {

    Lowered<IrExpr> lower(WithNode node, ScopeState s, LoweringContext ctx);
}
