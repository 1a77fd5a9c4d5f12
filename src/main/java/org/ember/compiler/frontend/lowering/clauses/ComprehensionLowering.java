package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.ForNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrExpr;

/**
 * Lowers {@code for} comprehensions.
 */
public interface ComprehensionLowering {

    /**
     * @param node    The comprehension.
     * @param collect {@code false} when the comprehension is a statement and its result is discarded.
     * @param s       The state before the comprehension.
     * @param ctx     The lowering context.
     * @return The lowered comprehension; bindings made inside do not escape.
     */
    Lowered<IrExpr> lower(ForNode node, boolean collect, ScopeState s, LoweringContext ctx);
}
