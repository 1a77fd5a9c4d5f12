package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.PinNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.VarBinding;
import org.ember.compiler.frontend.lowering.VarKey;
import org.ember.compiler.frontend.lowering.Variables;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrOp;
import org.ember.compiler.ir.IrVar;

import java.util.List;

/**
 * Converts {@code ^var} inside patterns.
 * <p>
 * The pinned value is the binding in scope when the match began. In function heads, where a
 * pattern cannot refer to an outer variable, the pin binds a fresh variable and adds an
 * equality guard against the pinned value.
 */
public final class PinLowerer implements INodeLowerer<PinNode> {

	@Override
	public Lowered<IrExpr> lower(PinNode node, ScopeState s, LoweringContext ctx) {
		VarNode var = node.var();
		if (!s.isMatch()) {
			throw ctx.error(node.meta(), CompilerErrorCode.PIN_OUTSIDE_MATCH,
					"cannot use ^%s outside of match clauses", var.name());
		}
		VarBinding pinned = s.backupVars().get(VarKey.of(var));
		if (pinned == null) {
			throw ctx.error(var.meta(), CompilerErrorCode.UNDEFINED_VARIABLE,
					"undefined variable ^%s", var.name());
		}
		if (var.isUnderscored()) {
			ctx.warn(var.meta(), "the underscored variable \"%s\" is used after being set. "
					+ "A leading underscore indicates that the value of the variable should be ignored. "
					+ "If this is intended please rename the variable to remove the underscore", var.name());
		}
		if (!pinned.safe()) {
			ctx.warn(var.meta(), "the variable \"%s\" is unsafe as it has been set inside a case/cond/receive/try. "
					+ "Please explicitly return the variable value instead", var.name());
		}

		IrAnno anno = IrAnno.of(node.meta());
		IrVar pinnedVar = new IrVar(anno, pinned.internalName());
		if (s.extra() != ScopeState.ExtraMode.PIN_GUARD) {
			return new Lowered<>(pinnedVar, s);
		}
		Lowered<IrExpr> fresh = Variables.translate(var, s, ctx);
		IrExpr guard = new IrOp(anno, "=:=", List.of(pinnedVar, fresh.value()));
		return new Lowered<>(fresh.value(), fresh.state().addExtraGuard(guard));
	}
}
