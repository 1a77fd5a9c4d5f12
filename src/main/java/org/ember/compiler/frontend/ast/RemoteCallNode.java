package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A qualified call {@code receiver.name(args)}. The receiver is an {@link AtomLiteral} for module calls
 * and any other expression for calls on values. A zero-argument call on a non-atom receiver is map
 * field access sugar.
 *
 * @param receiver The module or value the function is looked up on.
 * @param name     The function name.
 * @param meta     The node metadata.
 * @param args     The call arguments.
 */
public record RemoteCallNode(AstNode receiver, String name, Meta meta, List<AstNode> args) implements AstNode {

    public RemoteCallNode {
        args = List.copyOf(args);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(args.size() + 1);
        children.add(receiver);
        children.addAll(args);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new RemoteCallNode(newChildren.get(0), name, meta, newChildren.subList(1, newChildren.size()));
    }
}
