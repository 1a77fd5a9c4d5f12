package org.ember.compiler.frontend.lowering;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrVar;

import java.util.Optional;

/**
 * Resolution of source variables to internal names.
 */
public final class Variables {

    private Variables() {}

    /**
     * Inside a match, binds the variable (reusing the binding when the same match already bound it);
     * elsewhere, looks it up.
     *
     * @param var The variable reference.
     * @param s   The current state.
     * @param ctx The lowering context.
     * @return The lowered variable and the resulting state.
     */
    public static Lowered<IrExpr> translate(VarNode var, ScopeState s, LoweringContext ctx) {
        VarKey key = VarKey.of(var);
        IrAnno anno = IrAnno.of(var.meta());
        Optional<VarBinding> current = s.lookup(key);
        if (s.isMatch()) {
            if (current.isPresent() && s.matchVars().contains(key)) {
                return new Lowered<>(new IrVar(anno, current.get().internalName()), s);
            }
            VarBinding binding = ctx.freshBinding(var.name());
            return new Lowered<>(new IrVar(anno, binding.internalName()), s.bind(key, binding));
        }
        VarBinding binding = current.orElseThrow(() -> ctx.error(var.meta(), CompilerErrorCode.UNDEFINED_VARIABLE,
                "undefined variable \"%s\"", var.name()));
        return new Lowered<>(new IrVar(anno, binding.internalName()), s);
    }
}
