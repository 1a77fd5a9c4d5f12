package org.ember.compiler.frontend.expansion;

import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.Meta;

/**
 * Expands the patterns, guards and body of one function literal clause.
 */
public interface ClauseExpander {

    /**
     * @param fnMeta The metadata of the enclosing function literal.
     * @param clause The clause to expand.
     * @param env    The compilation environment.
     * @return The expanded clause.
     */
    ClauseNode expandClause(Meta fnMeta, ClauseNode clause, Environment env);
}
