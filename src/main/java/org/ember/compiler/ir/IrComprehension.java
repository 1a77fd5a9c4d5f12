package org.ember.compiler.ir;

import java.util.List;

/**
 * A list comprehension. When {@code collect} is {@code false} the body is evaluated for its effects
 * and the comprehension returns an empty list.
 */
public record IrComprehension(IrAnno anno, IrExpr body, List<Qualifier> qualifiers, boolean collect) implements IrExpr {

    public IrComprehension {
        qualifiers = List.copyOf(qualifiers);
    }

    /** A generator or filter. */
    public sealed interface Qualifier permits Generator, Filter {}

    /** {@code pattern <- source}. */
    public record Generator(IrAnno anno, IrExpr pattern, IrExpr source) implements Qualifier {}

    /** A boolean filter. */
    public record Filter(IrExpr condition) implements Qualifier {}
}
