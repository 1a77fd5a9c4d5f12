package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A comprehension {@code for qualifiers do body end}.
 *
 * @param meta       The node metadata.
 * @param qualifiers Generators ({@link GeneratorNode}) and filters, in source order.
 * @param body       The expression evaluated for each surviving combination.
 */
public record ForNode(Meta meta, List<AstNode> qualifiers, AstNode body) implements AstNode {

    public ForNode {
        qualifiers = List.copyOf(qualifiers);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(qualifiers);
        children.add(body);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int last = newChildren.size() - 1;
        return new ForNode(meta, newChildren.subList(0, last), newChildren.get(last));
    }
}
