package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A {@code cond} expression; each clause has exactly one condition.
 *
 * @param meta    The node metadata.
 * @param clauses The condition clauses, in source order.
 */
public record CondNode(Meta meta, List<ClauseNode> clauses) implements AstNode {

    public CondNode {
        clauses = List.copyOf(clauses);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(clauses);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new CondNode(meta, ClauseNode.clauses(newChildren));
    }
}
