package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.ForNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrExpr;

/**
 * Lowers a comprehension whose value is used. Comprehensions whose value is discarded are
 * handled by {@link BlockLowerer}.
 */
public final class ForLowerer implements INodeLowerer<ForNode> {

	@Override
	public Lowered<IrExpr> lower(ForNode node, ScopeState s, LoweringContext ctx) {
		return ctx.collaborators().comprehensions().lower(node, true, s, ctx);
	}
}
