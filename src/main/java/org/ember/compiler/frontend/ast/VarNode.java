package org.ember.compiler.frontend.ast;

/**
 * A variable reference. User variables have a {@code null} context; variables introduced by the
 * compiler carry the context (or a counter in their metadata) that keeps them apart from user names.
 *
 * @param name    The variable name.
 * @param meta    The node metadata.
 * @param context The lexical context, or {@code null}.
 */
public record VarNode(String name, Meta meta, String context) implements AstNode {

    /** The wildcard pattern name. */
    public static final String WILDCARD = "_";
    /** The caller-identity pseudo-variable. */
    public static final String CALLER = "__CALLER__";

    public static VarNode of(String name) {
        return new VarNode(name, Meta.EMPTY, null);
    }

    public boolean isWildcard() {
        return WILDCARD.equals(name);
    }

    /**
     * @return {@code true} for names that mark a value as deliberately unused.
     */
    public boolean isUnderscored() {
        return name.startsWith("_") && !isWildcard();
    }
}
