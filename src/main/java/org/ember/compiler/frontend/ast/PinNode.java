package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * The pin operator {@code ^var}: matches against the value the variable had before the match.
 *
 * @param meta The node metadata.
 * @param var  The pinned variable.
 */
public record PinNode(Meta meta, VarNode var) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(var);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new PinNode(meta, (VarNode) newChildren.get(0));
    }
}
