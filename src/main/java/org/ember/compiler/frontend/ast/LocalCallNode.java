package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A call to a function by its bare name, {@code name(args)}.
 *
 * @param name The function name.
 * @param meta The node metadata.
 * @param args The call arguments.
 */
public record LocalCallNode(String name, Meta meta, List<AstNode> args) implements AstNode {

    public LocalCallNode {
        args = List.copyOf(args);
    }

    @Override
    public List<AstNode> getChildren() {
        return args;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new LocalCallNode(name, meta, newChildren);
    }
}
