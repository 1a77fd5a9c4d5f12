package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrMatch;
import org.ember.compiler.ir.IrVar;

/**
 * Converts {@code pattern = expr}. The right side is evaluated first; the left side is then
 * lowered as a pattern in the resulting scope.
 */
public final class MatchLowerer implements INodeLowerer<MatchNode> {

	@Override
	public Lowered<IrExpr> lower(MatchNode node, ScopeState s, LoweringContext ctx) {
		IrAnno anno = IrAnno.of(node.meta());
		Lowered<IrExpr> right = ctx.lower(node.right(), s);
		if (node.left() instanceof VarNode var && var.isWildcard()) {
			return new Lowered<>(new IrMatch(anno, new IrVar(anno, VarNode.WILDCARD), right.value()), right.state());
		}
		Lowered<IrExpr> left = ctx.collaborators().clauses().match(st -> ctx.lower(node.left(), st), right.state());
		return new Lowered<>(new IrMatch(anno, left.value(), right.value()), left.state());
	}
}
