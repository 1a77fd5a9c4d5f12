package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code try} expression with its optional sections.
 *
 * @param meta          The node metadata.
 * @param body          The {@code do} section.
 * @param rescueClauses The {@code rescue} clauses.
 * @param catchClauses  The {@code catch} clauses.
 * @param elseClauses   The {@code else} clauses, matched against the value of the body.
 * @param after         The {@code after} section, or {@code null}.
 */
public record TryNode(
        Meta meta,
        AstNode body,
        List<ClauseNode> rescueClauses,
        List<ClauseNode> catchClauses,
        List<ClauseNode> elseClauses,
        AstNode after
) implements AstNode {

    public TryNode {
        rescueClauses = List.copyOf(rescueClauses);
        catchClauses = List.copyOf(catchClauses);
        elseClauses = List.copyOf(elseClauses);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(body);
        children.addAll(rescueClauses);
        children.addAll(catchClauses);
        children.addAll(elseClauses);
        if (after != null) {
            children.add(after);
        }
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int rescueEnd = 1 + rescueClauses.size();
        int catchEnd = rescueEnd + catchClauses.size();
        int elseEnd = catchEnd + elseClauses.size();
        return new TryNode(
                meta,
                newChildren.get(0),
                ClauseNode.clauses(newChildren.subList(1, rescueEnd)),
                ClauseNode.clauses(newChildren.subList(rescueEnd, catchEnd)),
                ClauseNode.clauses(newChildren.subList(catchEnd, elseEnd)),
                after != null ? newChildren.get(elseEnd) : null);
    }
}
