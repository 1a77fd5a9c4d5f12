package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.MapNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.PairNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrMap;
import org.ember.compiler.ir.IrMapField;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts map construction, update and patterns.
 * <p>
 * Keys are lowered in map-key mode. Construction uses {@code =>}; updates and patterns use
 * {@code :=}, except inside another map key where {@code =>} is kept.
 */
public final class MapLowerer implements INodeLowerer<MapNode> {

	@Override
	public Lowered<IrExpr> lower(MapNode node, ScopeState s, LoweringContext ctx) {
		if (node.isUpdate()) {
			Lowered<IrExpr> base = ctx.lowerArg(node.update(), s, s);
			return lowerFields(node.meta(), node.entries(), base.value(), base.state(), ctx);
		}
		return lowerFields(node.meta(), node.entries(), null, s, ctx);
	}

	/**
	 * Lowers the associations of a map.
	 *
	 * @param meta    The metadata of the map.
	 * @param entries The key/value associations.
	 * @param base    The lowered map being updated, or {@code null}.
	 * @param s       The state before the first association.
	 * @param ctx     The lowering context.
	 * @return The lowered map and the state after the last association.
	 */
	static Lowered<IrExpr> lowerFields(Meta meta, List<PairNode> entries, IrExpr base, ScopeState s,
										 LoweringContext ctx) {
		IrAnno anno = IrAnno.of(meta);
		ScopeState.ExtraMode extra = s.extra();
		boolean directKeys = extra == ScopeState.ExtraMode.MAP_KEY || s.isMatch();
		IrMapField.Kind kind;
		if (extra == ScopeState.ExtraMode.MAP_KEY) {
			kind = IrMapField.Kind.ASSOC;
		} else if (s.isMatch() || base != null) {
			kind = IrMapField.Kind.EXACT;
		} else {
			kind = IrMapField.Kind.ASSOC;
		}

		List<IrMapField> fields = new ArrayList<>(entries.size());
		ScopeState acc = s;
		for (PairNode entry : entries) {
			Lowered<IrExpr> key;
			Lowered<IrExpr> value;
			if (directKeys) {
				key = ctx.lower(entry.left(), acc.withExtra(ScopeState.ExtraMode.MAP_KEY));
				value = ctx.lower(entry.right(), key.state().withExtra(extra));
			} else {
				key = ctx.lowerArg(entry.left(), acc, s.withExtra(ScopeState.ExtraMode.MAP_KEY));
				value = ctx.lowerArg(entry.right(), key.state().withExtra(extra), s);
			}
			fields.add(new IrMapField(anno, kind, key.value(), value.value()));
			acc = value.state();
		}
		return new Lowered<>(new IrMap(anno, base, fields), acc.withExtra(extra));
	}
}
