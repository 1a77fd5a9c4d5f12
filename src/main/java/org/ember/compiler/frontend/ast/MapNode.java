package org.ember.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A map construction {@code %{k => v}} or update {@code %{base | k => v}}.
 *
 * @param meta    The node metadata.
 * @param update  The map being updated, or {@code null} for a plain construction.
 * @param entries The key/value associations.
 */
public record MapNode(Meta meta, AstNode update, List<PairNode> entries) implements AstNode {

    public MapNode {
        entries = List.copyOf(entries);
    }

    public boolean isUpdate() {
        return update != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(entries.size() + 1);
        if (update != null) {
            children.add(update);
        }
        children.addAll(entries);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int offset = update != null ? 1 : 0;
        List<PairNode> newEntries = new ArrayList<>(entries.size());
        for (AstNode child : newChildren.subList(offset, newChildren.size())) {
            newEntries.add((PairNode) child);
        }
        return new MapNode(meta, update != null ? newChildren.get(0) : null, newEntries);
    }
}
