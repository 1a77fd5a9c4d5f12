package org.ember.compiler.frontend.lowering;

import org.ember.compiler.frontend.ast.VarNode;

/**
 * Identity of a source variable: its name plus the counter or context that distinguishes it from
 * same-named variables introduced elsewhere.
 *
 * @param name The variable name.
 * @param kind {@code counter:N} for counted variables, the context otherwise ({@code null} for user variables).
 */
public record VarKey(String name, String kind) {

    /** Context of compiler-introduced variables that never leave the clause binding them. */
    public static final String GENERATED = "generated";

    public static VarKey of(VarNode var) {
        return var.meta().counter()
                .map(counter -> new VarKey(var.name(), "counter:" + counter))
                .orElseGet(() -> new VarKey(var.name(), var.context()));
    }

    public boolean isGenerated() {
        return GENERATED.equals(kind);
    }
}
