package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code receive} expression with an optional {@code after timeout -> body} arm.
 *
 * @param meta    The node metadata.
 * @param clauses The message clauses.
 * @param after   The timeout arm, or {@code null}.
 */
public record ReceiveNode(Meta meta, List<ClauseNode> clauses, ClauseNode after) implements AstNode {

    public ReceiveNode {
        clauses = List.copyOf(clauses);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(clauses);
        if (after != null) {
            children.add(after);
        }
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        if (after == null) {
            return new ReceiveNode(meta, ClauseNode.clauses(newChildren), null);
        }
        int last = newChildren.size() - 1;
        return new ReceiveNode(meta, ClauseNode.clauses(newChildren.subList(0, last)), (ClauseNode) newChildren.get(last));
    }
}
