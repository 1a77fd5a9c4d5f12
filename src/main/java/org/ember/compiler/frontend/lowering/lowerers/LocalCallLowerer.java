package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrCall;
import org.ember.compiler.ir.IrExpr;

import java.util.List;

public final class LocalCallLowerer implements INodeLowerer<LocalCallNode> {

	@Override
	public Lowered<IrExpr> lower(LocalCallNode node, ScopeState s, LoweringContext ctx) {
		IrAnno anno = IrAnno.of(node.meta());
		Lowered<List<IrExpr>> args = ctx.lowerArgs(node.args(), s);
		return new Lowered<>(new IrCall(anno, new IrAtom(anno, node.name()), args.value()), args.state());
	}
}
