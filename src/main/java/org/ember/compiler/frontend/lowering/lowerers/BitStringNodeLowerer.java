package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.BitStringNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrExpr;

/**
 * Delegates bit-string construction and patterns to the bit-string collaborator.
 */
public final class BitStringNodeLowerer implements INodeLowerer<BitStringNode> {

	@Override
	public Lowered<IrExpr> lower(BitStringNode node, ScopeState s, LoweringContext ctx) {
		return ctx.collaborators().bitStrings().lower(node, s, ctx);
	}
}
