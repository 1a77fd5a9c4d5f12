package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * An anonymous function literal {@code fn ... end}.
 *
 * @param meta    The node metadata.
 * @param clauses The function clauses, all of the same arity once expanded.
 */
public record FnNode(Meta meta, List<ClauseNode> clauses) implements AstNode {

    public FnNode {
        clauses = List.copyOf(clauses);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(clauses);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new FnNode(meta, ClauseNode.clauses(newChildren));
    }
}
