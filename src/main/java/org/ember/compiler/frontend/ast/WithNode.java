package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code with} expression.
 *
 * @param meta        The node metadata.
 * @param steps       Match steps ({@link GeneratorNode}) and plain expressions, in source order.
 * @param body        The {@code do} body.
 * @param elseClauses The {@code else} clauses for a value that failed to match.
 */
public record WithNode(Meta meta, List<AstNode> steps, AstNode body, List<ClauseNode> elseClauses) implements AstNode {

    public WithNode {
        steps = List.copyOf(steps);
        elseClauses = List.copyOf(elseClauses);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(steps);
        children.add(body);
        children.addAll(elseClauses);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int bodyIndex = steps.size();
        return new WithNode(
                meta,
                newChildren.subList(0, bodyIndex),
                newChildren.get(bodyIndex),
                ClauseNode.clauses(newChildren.subList(bodyIndex + 1, newChildren.size())));
    }
}
