package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.TryNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrBlock;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrTry;

import java.util.List;

/**
 * Converts {@code try}. Sections are lowered in the order do, rescue/catch, after, else. A section
 * sees what earlier sections bound as unsafe, since they may have been interrupted part way. Nothing
 * bound inside a try is visible after it.
 */
public final class TryLowerer implements INodeLowerer<TryNode> {

	@Override
	public Lowered<IrExpr> lower(TryNode node, ScopeState s, LoweringContext ctx) {
		ScopeState base = s.withExtra(ScopeState.ExtraMode.NONE);
		Lowered<IrExpr> body = ctx.lower(node.body(), base);

		Lowered<List<IrClause>> catches = ctx.collaborators().tryClauses().clauses(node.meta(),
				node.rescueClauses(), node.catchClauses(), ScopeState.mergeSection(base, body.state()), ctx);

		List<IrExpr> after = List.of();
		ScopeState afterState = ScopeState.mergeSection(base, catches.state());
		if (node.after() != null) {
			Lowered<IrExpr> lowered = ctx.lower(node.after(), afterState);
			after = IrBlock.unblock(lowered.value());
			afterState = lowered.state();
		}

		Lowered<List<IrClause>> elses = ctx.collaborators().clauses().clauses(node.meta(), node.elseClauses(),
				ScopeState.mergeSection(base, afterState), ctx);

		IrExpr result = new IrTry(IrAnno.of(node.meta()), IrBlock.unblock(body.value()), elses.value(),
				catches.value(), after);
		return new Lowered<>(result, ScopeState.mergeCounters(s, elses.state()));
	}
}
