package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrClause;

import java.util.List;

/**
 * Lowers the {@code rescue} and {@code catch} sections of a try into clauses matching
 * {@code {Kind, Reason, Stacktrace}}.
 */
public interface TryClauseLowering {

    Lowered<List<IrClause>> clauses(Meta meta, List<ClauseNode> rescueClauses, List<ClauseNode> catchClauses,
                                    ScopeState s, LoweringContext ctx);
}
