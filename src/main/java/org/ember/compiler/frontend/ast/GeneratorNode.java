package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A generator {@code pattern <- source}, used by comprehensions and {@code with}.
 *
 * @param meta    The node metadata.
 * @param pattern The pattern each element (or the value) is matched against.
 * @param source  The enumerated or matched expression.
 */
public record GeneratorNode(Meta meta, AstNode pattern, AstNode source) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(pattern, source);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new GeneratorNode(meta, newChildren.get(0), newChildren.get(1));
    }
}
