package org.ember.compiler.frontend.lowering;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.ir.IrExpr;

/**
 * Fallback lowerer used when no specific lowerer is registered.
 * Lowering cannot skip a node, so an unknown node aborts the unit.
 */
public final class DefaultNodeLowerer implements INodeLowerer<AstNode> {

	@Override
	public Lowered<IrExpr> lower(AstNode node, ScopeState s, LoweringContext ctx) {
		throw ctx.error(node.meta(), CompilerErrorCode.UNSUPPORTED_FORM,
				"no lowering rule for %s: %s", node.getClass().getSimpleName(), AstPrinter.toDisplayString(node));
	}
}
