package org.ember.compiler.frontend.ast;

/**
 * Marker for immediate literal values. Lowering a literal never introduces a binding,
 * so literal arguments are lowered without threading scope state.
 */
public interface Literal extends AstNode {}
