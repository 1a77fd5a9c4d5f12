package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call through a function value, {@code fun.(args)}.
 *
 * @param fun  The expression producing the function value.
 * @param meta The node metadata.
 * @param args The call arguments.
 */
public record AnonCallNode(AstNode fun, Meta meta, List<AstNode> args) implements AstNode {

    public AnonCallNode {
        args = List.copyOf(args);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(args.size() + 1);
        children.add(fun);
        children.addAll(args);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new AnonCallNode(newChildren.get(0), meta, newChildren.subList(1, newChildren.size()));
    }
}
