package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A guard wrapper {@code patterns when guard}. The last argument is the guard; a nested
 * {@code when} on the right side adds an alternative guard.
 *
 * @param meta The node metadata.
 * @param args The patterns followed by the guard.
 */
public record WhenNode(Meta meta, List<AstNode> args) implements AstNode {

    public WhenNode {
        args = List.copyOf(args);
    }

    public List<AstNode> patterns() {
        return args.subList(0, args.size() - 1);
    }

    public AstNode guard() {
        return args.get(args.size() - 1);
    }

    @Override
    public List<AstNode> getChildren() {
        return args;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new WhenNode(meta, newChildren);
    }
}
