package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrTuple;

import java.util.List;

public final class TupleLowerer implements INodeLowerer<TupleNode> {

	@Override
	public Lowered<IrExpr> lower(TupleNode node, ScopeState s, LoweringContext ctx) {
		Lowered<List<IrExpr>> elements = ctx.lowerArgs(node.elements(), s);
		return new Lowered<>(new IrTuple(IrAnno.of(node.meta()), elements.value()), elements.state());
	}
}
