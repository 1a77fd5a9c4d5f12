package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.BitStringNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrExpr;

/**
 * Lowers bit-string literals and patterns.
 */
public interface BitStringLowering {

    Lowered<IrExpr> lower(BitStringNode node, ScopeState s, LoweringContext ctx);
}
