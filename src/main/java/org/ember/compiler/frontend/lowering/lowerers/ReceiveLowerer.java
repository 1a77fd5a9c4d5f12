package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.ReceiveNode;
import org.ember.compiler.frontend.ast.WhenNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrReceive;

import java.util.List;

/**
 * Converts {@code receive}. The {@code after} arm is lowered with the message clauses so that
 * variables it binds are exported like theirs, then split off as the timeout.
 */
public final class ReceiveLowerer implements INodeLowerer<ReceiveNode> {

	@Override
	public Lowered<IrExpr> lower(ReceiveNode node, ScopeState s, LoweringContext ctx) {
		IrAnno anno = IrAnno.of(node.meta());
		ClauseNode after = node.after();
		if (after == null) {
			Lowered<List<IrClause>> clauses = ctx.collaborators().clauses().clauses(node.meta(), node.clauses(), s, ctx);
			return new Lowered<>(new IrReceive(anno, clauses.value(), null, List.of()), clauses.state());
		}
		if (after.args().size() != 1 || after.args().get(0) instanceof WhenNode) {
			throw ctx.error(after.meta(), CompilerErrorCode.INVALID_RECEIVE_AFTER,
					"expected a single timeout expression in receive after, got: %s", AstPrinter.toDisplayString(after));
		}
		Lowered<List<IrClause>> clauses = ctx.collaborators().clauses().clauses(node.meta(), node.clauses(), after, s, ctx);
		List<IrClause> all = clauses.value();
		IrClause timeout = all.get(all.size() - 1);
		IrExpr result = new IrReceive(anno, all.subList(0, all.size() - 1), timeout.patterns().get(0), timeout.body());
		return new Lowered<>(result, clauses.state());
	}
}
