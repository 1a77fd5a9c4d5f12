package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.WhenNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Clause arguments split into patterns and alternative guards.
 *
 * @param args   The patterns.
 * @param guards The alternative guards, empty when the clause has none.
 */
public record GuardedArgs(List<AstNode> args, List<AstNode> guards) {

    /**
     * Splits {@code [when(p1, ..., pn, g)]} into the patterns and the guards, where {@code g} may be
     * a chain {@code g1 when g2 when ...} of alternatives.
     *
     * @param argsWithGuards The clause arguments as written.
     * @return The split arguments.
     */
    public static GuardedArgs extract(List<AstNode> argsWithGuards) {
        if (argsWithGuards.size() == 1 && argsWithGuards.get(0) instanceof WhenNode when && when.args().size() >= 2) {
            return new GuardedArgs(when.patterns(), alternatives(when.guard()));
        }
        return new GuardedArgs(argsWithGuards, List.of());
    }

    private static List<AstNode> alternatives(AstNode guard) {
        List<AstNode> result = new ArrayList<>();
        AstNode current = guard;
        while (current instanceof WhenNode when && when.args().size() == 2) {
            result.add(when.args().get(0));
            current = when.args().get(1);
        }
        result.add(current);
        return result;
    }
}
