package org.ember.compiler.api;

import org.ember.compiler.diagnostics.Diagnostic;
import org.ember.compiler.ir.IrExpr;

import java.util.List;

/**
 * The output of the core for one compilation unit: the lowered forms, in source order, and the
 * warnings collected while producing them.
 *
 * @param fileName        The file the unit was read from.
 * @param forms           The lowered top-level forms.
 * @param callerRequested Whether any form referenced the caller-identity pseudo-variable.
 * @param warnings        The non-fatal diagnostics of the unit.
 */
public record LoweredProgram(
        String fileName,
        List<IrExpr> forms,
        boolean callerRequested,
        List<Diagnostic> warnings
) {
    public LoweredProgram {
        forms = List.copyOf(forms);
        warnings = List.copyOf(warnings);
    }
}
