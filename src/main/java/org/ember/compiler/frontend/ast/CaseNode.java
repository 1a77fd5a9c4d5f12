package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code case subject do clauses end} expression.
 *
 * @param meta    The node metadata.
 * @param subject The expression being matched.
 * @param clauses The match clauses, one pattern each.
 */
public record CaseNode(Meta meta, AstNode subject, List<ClauseNode> clauses) implements AstNode {

    public CaseNode {
        clauses = List.copyOf(clauses);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(clauses.size() + 1);
        children.add(subject);
        children.addAll(clauses);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new CaseNode(meta, newChildren.get(0), ClauseNode.clauses(newChildren.subList(1, newChildren.size())));
    }
}
