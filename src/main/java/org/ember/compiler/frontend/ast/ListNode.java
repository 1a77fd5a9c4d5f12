package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A list literal. A {@link ConsNode} may only appear as the last element and supplies the tail.
 *
 * @param elements The list elements.
 */
public record ListNode(List<AstNode> elements) implements AstNode {

    public ListNode {
        elements = List.copyOf(elements);
    }

    public static ListNode of(AstNode... elements) {
        return new ListNode(List.of(elements));
    }

    @Override
    public List<AstNode> getChildren() {
        return elements;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ListNode(newChildren);
    }
}
