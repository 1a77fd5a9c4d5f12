package org.ember.compiler.frontend.lowering;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.ir.IrExpr;

/**
 * Lowers a specific AST node type into the lowered form.
 * <p>
 * Implementations should be stateless. Nested nodes are lowered through {@link LoweringContext#lower}.
 *
 * @param <T> The concrete AST node type handled by this lowerer.
 */
public interface INodeLowerer<T extends AstNode> {

	/**
	 * Lowers the given node.
	 *
	 * @param node The AST node to lower.
	 * @param s    The scope state before the node.
	 * @param ctx  The lowering context used to lower children and reach collaborators.
	 * @return The lowered node and the scope state after it.
	 */
	Lowered<IrExpr> lower(T node, ScopeState s, LoweringContext ctx);
}
