package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.PairNode;
import org.ember.compiler.frontend.ast.StructNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrCase;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrMap;
import org.ember.compiler.ir.IrMapField;
import org.ember.compiler.ir.IrMatch;
import org.ember.compiler.ir.IrTuple;
import org.ember.compiler.ir.IrVar;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts struct literals and struct updates.
 * <p>
 * A literal is a map with an extra {@code __struct__} key. An update first checks that the value
 * is a struct of the expected name and raises {@code {badstruct, Name, Value}} otherwise.
 */
public final class StructLowerer implements INodeLowerer<StructNode> {

	private static final String STRUCT_KEY = "__struct__";

	@Override
	public Lowered<IrExpr> lower(StructNode node, ScopeState s, LoweringContext ctx) {
		if (!node.map().isUpdate()) {
			List<PairNode> entries = new ArrayList<>(node.map().entries());
			entries.add(new PairNode(AtomLiteral.of(STRUCT_KEY), node.name()));
			return MapLowerer.lowerFields(node.meta(), entries, null, s, ctx);
		}

		IrAnno anno = IrAnno.of(node.meta());
		IrAnno generated = anno.asGenerated();
		IrVar var = new IrVar(anno, ctx.buildVar());
		IrAtom name = new IrAtom(anno, node.name().value());
		IrMap shape = new IrMap(anno, null,
				List.of(new IrMapField(anno, IrMapField.Kind.EXACT, new IrAtom(anno, STRUCT_KEY), name)));
		IrExpr error = new IrTuple(anno, List.of(new IrAtom(anno, "badstruct"), name, var));

		Lowered<IrExpr> base = ctx.lowerArg(node.map().update(), s, s);
		Lowered<IrExpr> updated = MapLowerer.lowerFields(node.meta(), node.map().entries(), var, base.state(), ctx);

		IrExpr result = new IrCase(generated, base.value(), List.of(
				new IrClause(anno, List.of(new IrMatch(anno, var, shape)), List.of(), List.of(updated.value())),
				new IrClause(generated, List.of(var), List.of(), List.of(ctx.runtimeCall(anno, "error", List.of(error))))));
		return new Lowered<>(result, updated.state());
	}
}
