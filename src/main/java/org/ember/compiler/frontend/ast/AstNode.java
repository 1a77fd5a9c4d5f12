package org.ember.compiler.frontend.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {

    /**
     * @return The metadata of this node. Literals carry none and return {@link Meta#EMPTY}.
     */
    default Meta meta() {
        return Meta.EMPTY;
    }

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children, in the order returned by
     * {@link #getChildren()}.
     *
     * @param newChildren The new children for this node
     * @return A new instance of this node with the new children, or this node if it has no children
     */
    default AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return this;
    }
}
