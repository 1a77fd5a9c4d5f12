package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One arm {@code args -> body} of a function literal or a case-like construct. Guards are expressed by
 * a single {@link WhenNode} argument wrapping the patterns and the guard.
 *
 * @param meta The node metadata.
 * @param args The argument patterns.
 * @param body The clause body.
 */
public record ClauseNode(Meta meta, List<AstNode> args, AstNode body) implements AstNode {

    public ClauseNode {
        args = List.copyOf(args);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(args);
        children.add(body);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int last = newChildren.size() - 1;
        return new ClauseNode(meta, newChildren.subList(0, last), newChildren.get(last));
    }

    /**
     * Narrows a list of reconstructed children back to clauses.
     *
     * @param nodes Nodes known to be clauses.
     * @return The same nodes typed as clauses.
     */
    static List<ClauseNode> clauses(List<AstNode> nodes) {
        List<ClauseNode> clauses = new ArrayList<>(nodes.size());
        for (AstNode node : nodes) {
            clauses.add((ClauseNode) node);
        }
        return clauses;
    }
}
