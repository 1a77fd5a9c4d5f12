package org.ember.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can abort the expansion or lowering of a unit.
 * This decouples the test logic from the formatted error messages.
 */
public enum CompilerErrorCode {
    // region Function literal and capture expansion
    /** Clauses of one anonymous function have different arities. */
    ARITY_MISMATCH,
    /** A name/arity capture used an arity outside 0..255 or a non-integer arity. */
    INVALID_CAPTURE_ARITY,
    /** A capture does not match any recognized form or contains no placeholder. */
    INVALID_CAPTURE_SHAPE,
    /** A multi-expression block was used as the body of a capture. */
    BLOCK_IN_CAPTURE,
    /** A bare &N was found outside of a capture. */
    BARE_CAPTURE_DIGIT,
    /** A placeholder &N used N less than one. */
    NON_POSITIVE_PLACEHOLDER,
    /** A capture operator was nested inside another capture. */
    NESTED_CAPTURE,
    /** A placeholder was used without all of its predecessors. */
    GAP_IN_PLACEHOLDERS,
    // endregion

    // region Lowering
    /** A variable was referenced before being bound. */
    UNDEFINED_VARIABLE,
    /** A pin operator was used outside of a pattern. */
    PIN_OUTSIDE_MATCH,
    /** A receive timeout arm did not consist of a single timeout expression. */
    INVALID_RECEIVE_AFTER,
    /** A cond clause did not have exactly one condition. */
    INVALID_COND_CLAUSE,
    /** A node has no lowering rule or a collaborator rejected its shape. */
    UNSUPPORTED_FORM
    // endregion
}
