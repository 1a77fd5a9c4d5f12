package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.AnonCallNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrCall;
import org.ember.compiler.ir.IrExpr;

import java.util.List;

/**
 * Converts {@code fun.(args)}. The function value is evaluated before the arguments.
 */
public final class AnonCallLowerer implements INodeLowerer<AnonCallNode> {

	@Override
	public Lowered<IrExpr> lower(AnonCallNode node, ScopeState s, LoweringContext ctx) {
		Lowered<IrExpr> fun = ctx.lower(node.fun(), s);
		Lowered<List<IrExpr>> args = ctx.lowerArgs(node.args(), fun.state());
		return new Lowered<>(new IrCall(IrAnno.of(node.meta()), fun.value(), args.value()),
				ScopeState.mergeVars(fun.state(), args.state()));
	}
}
