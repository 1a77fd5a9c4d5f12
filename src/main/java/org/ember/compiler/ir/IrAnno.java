package org.ember.compiler.ir;

import org.ember.compiler.frontend.ast.Meta;

/**
 * Annotation of a lowered node.
 *
 * @param line      The source line, or 0 when unknown.
 * @param generated Whether the node was synthesized by the compiler.
 */
public record IrAnno(int line, boolean generated) {

    public static final IrAnno NONE = new IrAnno(0, false);
    /** A generated node without position. */
    public static final IrAnno GENERATED = new IrAnno(0, true);

    public static IrAnno of(Meta meta) {
        return new IrAnno(meta.line(), meta.isGenerated());
    }

    public IrAnno asGenerated() {
        return generated ? this : new IrAnno(line, true);
    }
}
