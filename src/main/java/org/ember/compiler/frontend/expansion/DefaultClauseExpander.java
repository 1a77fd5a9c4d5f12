package org.ember.compiler.frontend.expansion;

import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.Meta;

/**
 * Expands the function literals and captures nested anywhere inside a clause.
 */
public class DefaultClauseExpander implements ClauseExpander {

    private final Expander expander;

    public DefaultClauseExpander(Expander expander) {
        this.expander = expander;
    }

    @Override
    public ClauseNode expandClause(Meta fnMeta, ClauseNode clause, Environment env) {
        return (ClauseNode) expander.expand(clause, env);
    }
}
