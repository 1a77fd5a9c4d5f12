package org.ember.compiler.frontend.ast;

import java.util.List;

/**
 * A struct construction {@code %Name{...}} or update {@code %Name{base | ...}}.
 *
 * @param meta The node metadata.
 * @param name The struct module.
 * @param map  The associations, possibly in update form.
 */
public record StructNode(Meta meta, AtomLiteral name, MapNode map) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(map);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new StructNode(meta, name, (MapNode) newChildren.get(0));
    }
}
