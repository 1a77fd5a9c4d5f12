package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * The {@code head | tail} element closing a list literal.
 *
 * @param meta The node metadata.
 * @param head The last proper element.
 * @param tail The tail of the list.
 */
public record ConsNode(Meta meta, AstNode head, AstNode tail) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(head, tail);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ConsNode(meta, newChildren.get(0), newChildren.get(1));
    }
}
