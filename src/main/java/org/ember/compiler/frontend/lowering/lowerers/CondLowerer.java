package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.CaseNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.CondNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.ast.WhenNode;
import org.ember.compiler.frontend.lowering.BooleanAnalysis;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.VarKey;
import org.ember.compiler.ir.IrExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites {@code cond} into nested cases, built from the last clause backwards, and lowers the result.
 * <p>
 * A condition known to return a boolean is matched against {@code true} and {@code false}; any other
 * condition is matched against a generated variable guarded to be neither {@code nil} nor {@code false};
 * that variable is not exported from the case.
 * When no clause matches, {@code cond_clause} is raised, unless the last condition is a truthy atom.
 */
public final class CondLowerer implements INodeLowerer<CondNode> {

	@Override
	public Lowered<IrExpr> lower(CondNode node, ScopeState s, LoweringContext ctx) {
		if (node.clauses().isEmpty()) {
			throw ctx.error(node.meta(), CompilerErrorCode.INVALID_COND_CLAUSE, "cond requires at least one clause");
		}
		for (ClauseNode clause : node.clauses()) {
			if (clause.args().size() != 1) {
				throw ctx.error(clause.meta(), CompilerErrorCode.INVALID_COND_CLAUSE,
						"expected exactly one condition in cond clause, got: %s", AstPrinter.toDisplayString(clause));
			}
		}
		List<ClauseNode> reversed = new ArrayList<>(node.clauses());
		Collections.reverse(reversed);
		ClauseNode last = reversed.get(0);

		AstNode acc;
		List<ClauseNode> remaining;
		if (last.args().get(0) instanceof AtomLiteral atom && atom.isTruthy()) {
			acc = last.body();
			remaining = reversed.subList(1, reversed.size());
		} else {
			acc = new RemoteCallNode(AtomLiteral.of(ctx.config().runtimeModule()), "error", Meta.EMPTY,
					List.of(AtomLiteral.of("cond_clause")));
			remaining = reversed;
		}

		Meta oldMeta = last.meta();
		for (ClauseNode clause : remaining) {
			acc = buildCase(clause, acc, oldMeta, ctx);
			oldMeta = clause.meta();
		}
		if (acc instanceof CaseNode outer) {
			acc = new CaseNode(node.meta(), outer.subject(), outer.clauses());
		}
		return ctx.lower(acc, s);
	}

	private static AstNode buildCase(ClauseNode clause, AstNode otherwise, Meta falsyMeta, LoweringContext ctx) {
		AstNode condition = clause.args().get(0);
		AstNode body = clause.body();
		String runtime = ctx.config().runtimeModule();

		AstNode subject;
		ClauseNode truthy;
		AstNode falsyPattern;
		if (condition instanceof MatchNode match && match.left() instanceof VarNode bound && sameVar(bound, body)
				&& BooleanAnalysis.returnsBoolean(match.right(), ctx.config())) {
			subject = match.right();
			truthy = new ClauseNode(clause.meta(), List.of(AtomLiteral.TRUE), AtomLiteral.TRUE);
			falsyPattern = AtomLiteral.FALSE;
		} else if (BooleanAnalysis.returnsBoolean(condition, ctx.config())) {
			subject = condition;
			truthy = new ClauseNode(clause.meta(), List.of(AtomLiteral.TRUE), body);
			falsyPattern = AtomLiteral.FALSE;
		} else {
			VarNode var = new VarNode("cond", Meta.EMPTY.with(Meta.GENERATED, true), VarKey.GENERATED);
			AstNode notNil = new RemoteCallNode(AtomLiteral.of(runtime), "/=", Meta.EMPTY, List.of(var, AtomLiteral.NIL));
			AstNode notFalse = new RemoteCallNode(AtomLiteral.of(runtime), "/=", Meta.EMPTY, List.of(var, AtomLiteral.FALSE));
			AstNode guard = new RemoteCallNode(AtomLiteral.of(runtime), "andalso", Meta.EMPTY, List.of(notNil, notFalse));
			subject = condition;
			truthy = new ClauseNode(clause.meta(), List.of(new WhenNode(Meta.EMPTY, List.of(var, guard))), body);
			falsyPattern = VarNode.of(VarNode.WILDCARD);
		}
		ClauseNode falsy = new ClauseNode(falsyMeta, List.of(falsyPattern), otherwise);
		return new CaseNode(clause.meta(), subject, List.of(truthy, falsy));
	}

	private static boolean sameVar(VarNode var, AstNode body) {
		return body instanceof VarNode other && other.name().equals(var.name())
				&& Objects.equals(other.context(), var.context());
	}
}
