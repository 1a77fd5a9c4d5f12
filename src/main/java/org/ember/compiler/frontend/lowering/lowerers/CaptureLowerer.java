package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrInteger;
import org.ember.compiler.ir.IrLocalFun;
import org.ember.compiler.ir.IrRemoteFun;

/**
 * Converts the function references left by capture expansion: {@code &Mod.fun/arity} and
 * {@code &fun/arity}. Any other capture should have been expanded into a closure already.
 */
public final class CaptureLowerer implements INodeLowerer<CaptureNode> {

	@Override
	public Lowered<IrExpr> lower(CaptureNode node, ScopeState s, LoweringContext ctx) {
		IrAnno anno = IrAnno.of(node.meta());
		if (node.expr() instanceof LocalCallNode slash && "/".equals(slash.name()) && slash.args().size() == 2
				&& slash.args().get(1) instanceof IntegerLiteral arity) {
			if (slash.args().get(0) instanceof RemoteCallNode remote && remote.args().isEmpty()) {
				Lowered<IrExpr> module = ctx.lower(remote.receiver(), s);
				IrExpr fun = new IrRemoteFun(anno, module.value(), new IrAtom(anno, remote.name()),
						new IrInteger(anno, arity.value()));
				return new Lowered<>(fun, module.state());
			}
			if (slash.args().get(0) instanceof VarNode local) {
				return new Lowered<>(new IrLocalFun(anno, local.name(), (int) arity.value()), s);
			}
		}
		throw ctx.error(node.meta(), CompilerErrorCode.INVALID_CAPTURE_SHAPE,
				"invalid function reference, expected &Mod.fun/arity or &fun/arity, got: %s",
				AstPrinter.toDisplayString(node));
	}
}
