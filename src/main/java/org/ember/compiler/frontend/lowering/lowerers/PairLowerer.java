package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.PairNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrTuple;

import java.util.List;

/**
 * Converts two-element tuples. Pairs carry no position.
 */
public final class PairLowerer implements INodeLowerer<PairNode> {

	@Override
	public Lowered<IrExpr> lower(PairNode node, ScopeState s, LoweringContext ctx) {
		Lowered<List<IrExpr>> elements = ctx.lowerArgs(List.of(node.left(), node.right()), s);
		return new Lowered<>(new IrTuple(IrAnno.NONE, elements.value()), elements.state());
	}
}
