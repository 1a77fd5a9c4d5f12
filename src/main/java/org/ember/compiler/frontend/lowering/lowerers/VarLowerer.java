package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.Variables;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrVar;

/**
 * Converts variable references and bindings.
 * The caller pseudo-variable is passed through by name and marks the scope as needing the caller.
 */
public final class VarLowerer implements INodeLowerer<VarNode> {

	@Override
	public Lowered<IrExpr> lower(VarNode node, ScopeState s, LoweringContext ctx) {
		IrAnno anno = IrAnno.of(node.meta());
		if (VarNode.CALLER.equals(node.name())) {
			return new Lowered<>(new IrVar(anno, VarNode.CALLER), s.withCaller(true));
		}
		if (node.isWildcard() && s.isMatch()) {
			return new Lowered<>(new IrVar(anno, VarNode.WILDCARD), s);
		}
		return Variables.translate(node, s, ctx);
	}
}
