package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * The capture operator {@code &expr}. With an integer payload it is the placeholder {@code &N}.
 *
 * @param meta The node metadata.
 * @param expr The captured expression, or the placeholder index.
 */
public record CaptureNode(Meta meta, AstNode expr) implements AstNode {

    /**
     * @return {@code true} when this node is a placeholder {@code &N}.
     */
    public boolean isPlaceholder() {
        return expr instanceof IntegerLiteral;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expr);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new CaptureNode(meta, newChildren.get(0));
    }
}
