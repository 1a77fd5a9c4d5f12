package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;

import java.util.List;

/**
 * Lowers patterns and clauses.
 */
public interface ClauseLowering {

    /**
     * Lowers something in match context.
     *
     * @param <T> The kind of lowered value.
     */
    @FunctionalInterface
    interface MatchStep<T> {
        Lowered<T> apply(ScopeState s);
    }

    /**
     * Lowers the argument patterns of a clause. Runs in match context.
     */
    @FunctionalInterface
    interface ArgStep {
        Lowered<List<IrExpr>> apply(List<AstNode> args, ScopeState s);
    }

    /**
     * Runs {@code step} in match context. When a match begins here, the variables in scope are
     * snapshotted for pins and the set of variables bound by the match starts empty; both are
     * restored afterwards along with the context.
     */
    <T> Lowered<T> match(MatchStep<T> step, ScopeState s);

    /**
     * Lowers one clause.
     *
     * @param meta    The clause metadata.
     * @param argStep Lowers the argument patterns.
     * @param args    The argument patterns, without guards.
     * @param body    The clause body.
     * @param guards  Alternative guards; empty when the clause is unguarded.
     * @param s       The state before the clause.
     * @param ctx     The lowering context.
     * @return The lowered clause and the state at the end of its body.
     */
    Lowered<IrClause> clause(Meta meta, ArgStep argStep, List<AstNode> args, AstNode body, List<AstNode> guards,
                             ScopeState s, LoweringContext ctx);

    /**
     * Lowers the clauses of a case-like construct; the resulting state exposes the variables bound
     * by the clauses under common names.
     */
    Lowered<List<IrClause>> clauses(Meta meta, List<ClauseNode> clauses, ScopeState s, LoweringContext ctx);

    /**
     * Same as {@link #clauses(Meta, List, ScopeState, LoweringContext)} with a trailing timeout clause
     * whose single argument is an expression rather than a pattern. The timeout clause is lowered last.
     */
    Lowered<List<IrClause>> clauses(Meta meta, List<ClauseNode> clauses, ClauseNode timeout, ScopeState s,
                                    LoweringContext ctx);
}
