package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.WithNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrExpr;

public final class WithLowerer implements INodeLowerer<WithNode> {

	@Override
	public Lowered<IrExpr> lower(WithNode node, ScopeState s, LoweringContext ctx) {
		return ctx.collaborators().withs().lower(node, s, ctx);
	}
}
