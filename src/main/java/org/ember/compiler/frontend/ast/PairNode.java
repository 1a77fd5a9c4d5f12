package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A two-element tuple literal. Also used for keyword entries and map associations.
 *
 * @param left  The first element.
 * @param right The second element.
 */
public record PairNode(AstNode left, AstNode right) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new PairNode(newChildren.get(0), newChildren.get(1));
    }
}
