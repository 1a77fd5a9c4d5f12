package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A match {@code left = right}.
 *
 * @param meta  The node metadata.
 * @param left  The pattern.
 * @param right The matched expression.
 */
public record MatchNode(Meta meta, AstNode left, AstNode right) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new MatchNode(meta, newChildren.get(0), newChildren.get(1));
    }
}
