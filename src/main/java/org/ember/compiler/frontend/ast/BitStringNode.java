package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A bit-string construction {@code <<a, b :: size(8)>>}. A segment with a type specification is a
 * {@link LocalCallNode} named {@code ::}.
 *
 * @param meta     The node metadata.
 * @param segments The segments.
 */
public record BitStringNode(Meta meta, List<AstNode> segments) implements AstNode {

    public BitStringNode {
        segments = List.copyOf(segments);
    }

    @Override
    public List<AstNode> getChildren() {
        return segments;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new BitStringNode(meta, newChildren);
    }
}
