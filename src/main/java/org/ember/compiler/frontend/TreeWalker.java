package org.ember.compiler.frontend;

import org.ember.compiler.frontend.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A generic class for rewriting an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker relies on {@link AstNode#getChildren()} /
 * {@link AstNode#reconstructWithChildren(List)} so that it never needs to know the shape of a node.
 */
public class TreeWalker {

    /**
     * Rewrites a tree top-down. The rewriter is offered every node before its children; a non-null
     * result replaces the node and is not descended into, {@code null} means "keep this node and
     * rewrite its children". Children are visited left to right.
     *
     * @param node     The root node to transform.
     * @param rewriter The rewrite function.
     * @return The transformed node (the same instance when nothing changed).
     */
    public AstNode transform(AstNode node, Function<AstNode, AstNode> rewriter) {
        if (node == null) {
            return null;
        }
        AstNode replacement = rewriter.apply(node);
        if (replacement != null) {
            return replacement;
        }

        List<AstNode> children = node.getChildren();
        List<AstNode> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;
        for (AstNode child : children) {
            AstNode transformedChild = transform(child, rewriter);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }
        return childrenChanged ? node.reconstructWithChildren(transformedChildren) : node;
    }
}
