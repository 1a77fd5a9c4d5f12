package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.BlockNode;
import org.ember.compiler.frontend.ast.ForNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrBlock;
import org.ember.compiler.ir.IrExpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts a block, threading the scope through its expressions in order.
 * <p>
 * Nested blocks are flattened, including a trailing one, and an empty block is {@code nil}. A comprehension that is not the last expression, or whose value is
 * bound to {@code _}, does not collect its results.
 */
public final class BlockLowerer implements INodeLowerer<BlockNode> {

	@Override
	public Lowered<IrExpr> lower(BlockNode node, ScopeState s, LoweringContext ctx) {
		Deque<AstNode> pending = new ArrayDeque<>(node.exprs());
		List<IrExpr> lowered = new ArrayList<>();
		ScopeState acc = s;
		while (!pending.isEmpty()) {
			AstNode expr = pending.pollFirst();
			boolean last = pending.isEmpty();
			if (expr instanceof BlockNode nested) {
				List<AstNode> inner = nested.exprs();
				for (int i = inner.size() - 1; i >= 0; i--) {
					pending.addFirst(inner.get(i));
				}
				continue;
			}
			ForNode discarded = last ? null : discardedComprehension(expr);
			Lowered<IrExpr> result = discarded != null
					? ctx.collaborators().comprehensions().lower(discarded, false, acc, ctx)
					: ctx.lower(expr, acc);
			lowered.add(result.value());
			acc = result.state();
		}
		IrAnno anno = IrAnno.of(node.meta());
		if (lowered.isEmpty()) {
			return new Lowered<>(new IrAtom(anno, "nil"), acc);
		}
		return new Lowered<>(new IrBlock(anno, lowered), acc);
	}

	private static ForNode discardedComprehension(AstNode expr) {
		if (expr instanceof ForNode comprehension) {
			return comprehension;
		}
		if (expr instanceof MatchNode match && match.left() instanceof VarNode var && var.isWildcard()
				&& match.right() instanceof ForNode comprehension) {
			return comprehension;
		}
		return null;
	}
}
