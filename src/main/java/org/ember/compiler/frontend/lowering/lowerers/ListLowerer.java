package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.ConsNode;
import org.ember.compiler.frontend.ast.ListNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrCons;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrNil;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts list literals into a chain of cons cells. A trailing {@code head | tail} element
 * supplies the tail; otherwise the chain ends in the empty list.
 */
public final class ListLowerer implements INodeLowerer<ListNode> {

	@Override
	public Lowered<IrExpr> lower(ListNode node, ScopeState s, LoweringContext ctx) {
		List<AstNode> elements = new ArrayList<>(node.elements());
		boolean improper = !elements.isEmpty() && elements.get(elements.size() - 1) instanceof ConsNode;
		if (improper) {
			ConsNode cons = (ConsNode) elements.remove(elements.size() - 1);
			elements.add(cons.head());
			elements.add(cons.tail());
		}

		Lowered<List<IrExpr>> lowered = ctx.lowerArgs(elements, s);
		List<IrExpr> values = lowered.value();
		int heads = improper ? values.size() - 1 : values.size();
		IrExpr list = improper ? values.get(values.size() - 1) : new IrNil(IrAnno.NONE);
		for (int i = heads - 1; i >= 0; i--) {
			list = new IrCons(IrAnno.NONE, values.get(i), list);
		}
		return new Lowered<>(list, lowered.state());
	}
}
