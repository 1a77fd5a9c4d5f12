package org.ember.compiler.frontend.lowering;

/**
 * A lowering result paired with the scope state after producing it.
 *
 * @param value The lowered value.
 * @param state The resulting state.
 * @param <T>   The kind of value.
 */
public record Lowered<T>(T value, ScopeState state) {}
