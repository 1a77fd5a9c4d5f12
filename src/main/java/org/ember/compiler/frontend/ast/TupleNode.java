package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A tuple construction {@code {a, b, c}} of any size other than the two-element literal form.
 *
 * @param meta     The node metadata.
 * @param elements The tuple elements.
 */
public record TupleNode(Meta meta, List<AstNode> elements) implements AstNode {

    public TupleNode {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return elements;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new TupleNode(meta, newChildren);
    }
}
