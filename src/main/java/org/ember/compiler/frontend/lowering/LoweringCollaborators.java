package org.ember.compiler.frontend.lowering;

import org.ember.compiler.frontend.lowering.clauses.BitStringLowering;
import org.ember.compiler.frontend.lowering.clauses.ClauseLowering;
import org.ember.compiler.frontend.lowering.clauses.ComprehensionLowering;
import org.ember.compiler.frontend.lowering.clauses.DefaultBitStringLowering;
import org.ember.compiler.frontend.lowering.clauses.DefaultClauseLowering;
import org.ember.compiler.frontend.lowering.clauses.DefaultComprehensionLowering;
import org.ember.compiler.frontend.lowering.clauses.DefaultTryClauseLowering;
import org.ember.compiler.frontend.lowering.clauses.DefaultWithLowering;
import org.ember.compiler.frontend.lowering.clauses.TryClauseLowering;
import org.ember.compiler.frontend.lowering.clauses.WithLowering;

/**
 * The sub-translators the node lowerers delegate to.
 *
 * @param clauses        Patterns and clauses.
 * @param tryClauses     The rescue and catch sections of try.
 * @param bitStrings     Bit-strings.
 * @param comprehensions {@code for}.
 * @param withs          {@code with}.
 */
public record LoweringCollaborators(
        ClauseLowering clauses,
        TryClauseLowering tryClauses,
        BitStringLowering bitStrings,
        ComprehensionLowering comprehensions,
        WithLowering withs
) {

    /**
     * @return The built-in implementations.
     */
    public static LoweringCollaborators defaults() {
        return new LoweringCollaborators(
                new DefaultClauseLowering(),
                new DefaultTryClauseLowering(),
                new DefaultBitStringLowering(),
                new DefaultComprehensionLowering(),
                new DefaultWithLowering());
    }

    public LoweringCollaborators withClauses(ClauseLowering newClauses) {
        return new LoweringCollaborators(newClauses, tryClauses, bitStrings, comprehensions, withs);
    }
}
