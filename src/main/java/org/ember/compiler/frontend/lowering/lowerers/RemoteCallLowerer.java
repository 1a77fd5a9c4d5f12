package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrCall;
import org.ember.compiler.ir.IrCase;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrMap;
import org.ember.compiler.ir.IrMapField;
import org.ember.compiler.ir.IrOp;
import org.ember.compiler.ir.IrRemote;
import org.ember.compiler.ir.IrTuple;
import org.ember.compiler.ir.IrVar;

import java.util.List;

/**
 * Converts qualified calls.
 * <p>
 * {@code value.field} on a non-module receiver reads the key from a map, raises
 * {@code {badkey, field, Value}} when a map lacks it, and calls the zero-arity function otherwise.
 * Calls to guard operators of the runtime module become operators so they can be used in guards
 * and patterns.
 */
public final class RemoteCallLowerer implements INodeLowerer<RemoteCallNode> {

	@Override
	public Lowered<IrExpr> lower(RemoteCallNode node, ScopeState s, LoweringContext ctx) {
		if (node.args().isEmpty() && !(node.receiver() instanceof AtomLiteral)) {
			return fieldAccess(node, s, ctx);
		}
		IrAnno anno = IrAnno.of(node.meta());
		Lowered<IrExpr> receiver = ctx.lower(node.receiver(), s);
		Lowered<List<IrExpr>> args = ctx.lowerArgs(node.args(), receiver.state());
		ScopeState result = ScopeState.mergeVars(receiver.state(), args.state());

		if (node.receiver() instanceof AtomLiteral module && module.value().equals(ctx.config().runtimeModule())
				&& ctx.config().isGuardOperator(node.name(), node.args().size())) {
			return new Lowered<>(new IrOp(anno, node.name(), args.value()), result);
		}
		IrRemote target = new IrRemote(anno, receiver.value(), new IrAtom(anno, node.name()));
		return new Lowered<>(new IrCall(anno, target, args.value()), result);
	}

	private Lowered<IrExpr> fieldAccess(RemoteCallNode node, ScopeState s, LoweringContext ctx) {
		Lowered<IrExpr> receiver = ctx.lower(node.receiver(), s);
		IrAnno anno = IrAnno.of(node.meta());
		IrAnno generated = anno.asGenerated();
		IrAtom field = new IrAtom(anno, node.name());
		IrVar var = new IrVar(anno, ctx.buildVar());
		IrExpr error = new IrTuple(anno, List.of(new IrAtom(anno, "badkey"), field, var));

		IrClause found = new IrClause(generated,
				List.of(new IrMap(anno, null, List.of(new IrMapField(anno, IrMapField.Kind.EXACT, field, var)))),
				List.of(), List.of(var));
		IrClause missing = new IrClause(IrAnno.GENERATED, List.of(var),
				List.of(List.of(ctx.runtimeCall(IrAnno.GENERATED, "is_map", List.of(var)))),
				List.of(ctx.runtimeCall(anno, "error", List.of(error))));
		IrClause call = new IrClause(generated, List.of(var), List.of(),
				List.of(new IrCall(generated, new IrRemote(generated, var, field), List.of())));
		return new Lowered<>(new IrCase(generated, receiver.value(), List.of(found, missing, call)), receiver.state());
	}
}
