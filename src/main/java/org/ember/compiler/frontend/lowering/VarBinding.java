package org.ember.compiler.frontend.lowering;

/**
 * What a {@link VarKey} currently refers to.
 *
 * @param internalName The name of the variable in the lowered form.
 * @param counter      The number the internal name was derived from.
 * @param safe         {@code false} when the variable is only bound on some paths that led here.
 */
public record VarBinding(String internalName, long counter, boolean safe) {

    public VarBinding unsafe() {
        return safe ? new VarBinding(internalName, counter, false) : this;
    }
}
