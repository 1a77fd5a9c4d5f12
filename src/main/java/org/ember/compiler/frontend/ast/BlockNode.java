package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A sequence of expressions evaluated in order; the last one is the value.
 *
 * @param meta  The node metadata.
 * @param exprs The expressions.
 */
public record BlockNode(Meta meta, List<AstNode> exprs) implements AstNode {

    public BlockNode {
        exprs = List.copyOf(exprs);
    }

    @Override
    public List<AstNode> getChildren() {
        return exprs;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new BlockNode(meta, newChildren);
    }
}
