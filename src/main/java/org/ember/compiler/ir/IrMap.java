package org.ember.compiler.ir;

import java.util.List;

/**
 * A map construction, or an update of {@code base} when it is not {@code null}.
 *
 * @param anno   The annotation.
 * @param base   The updated map, or {@code null}.
 * @param fields The associations, in source order.
 */
public record IrMap(IrAnno anno, IrExpr base, List<IrMapField> fields) implements IrExpr {
    public IrMap {
        fields = List.copyOf(fields);
    }
}
