package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.CaseNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrCase;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;

import java.util.List;

public final class CaseLowerer implements INodeLowerer<CaseNode> {

	@Override
	public Lowered<IrExpr> lower(CaseNode node, ScopeState s, LoweringContext ctx) {
		Lowered<IrExpr> subject = ctx.lower(node.subject(), s);
		ScopeState afterSubject = subject.state();
		Lowered<List<IrClause>> clauses = ctx.collaborators().clauses().clauses(node.meta(), node.clauses(),
				afterSubject.withExtra(ScopeState.ExtraMode.NONE), ctx);
		IrExpr result = new IrCase(IrAnno.of(node.meta()), subject.value(), clauses.value());
		return new Lowered<>(result, clauses.state().withExtra(afterSubject.extra()));
	}
}
