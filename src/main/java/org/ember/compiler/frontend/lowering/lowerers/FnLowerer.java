package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.FnNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.clauses.GuardedArgs;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrClosure;
import org.ember.compiler.ir.IrExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts anonymous functions. Every clause starts from the enclosing scope, and no binding made
 * inside a clause is visible after the function. Pins in the heads become equality guards.
 */
public final class FnLowerer implements INodeLowerer<FnNode> {

	@Override
	public Lowered<IrExpr> lower(FnNode node, ScopeState s, LoweringContext ctx) {
		List<IrClause> clauses = new ArrayList<>(node.clauses().size());
		ScopeState acc = s;
		for (ClauseNode clause : node.clauses()) {
			GuardedArgs split = GuardedArgs.extract(clause.args());
			Lowered<IrClause> lowered = ctx.collaborators().clauses().clause(clause.meta(),
					(args, st) -> lowerHead(args, st, ctx), split.args(), clause.body(), split.guards(), acc, ctx);
			clauses.add(lowered.value());
			acc = ScopeState.mergeCounters(s, lowered.state());
		}
		return new Lowered<>(new IrClosure(IrAnno.of(node.meta()), clauses), acc);
	}

	private static Lowered<List<IrExpr>> lowerHead(List<AstNode> args, ScopeState s, LoweringContext ctx) {
		Lowered<List<IrExpr>> lowered = ctx.lowerArgs(args, s.withExtra(ScopeState.ExtraMode.PIN_GUARD));
		return new Lowered<>(lowered.value(), lowered.state().withExtra(s.extra()));
	}
}
