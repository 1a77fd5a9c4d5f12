package org.ember.compiler.ir;

import java.util.List;

/**
 * One segment of an {@link IrBin}.
 *
 * @param anno  The annotation.
 * @param value The segment value.
 * @param size  The segment size, or {@code null} for the type's default.
 * @param types The type specifiers, empty for the default.
 */
public record IrBinElement(IrAnno anno, IrExpr value, IrExpr size, List<String> types) {
    public IrBinElement {
        types = List.copyOf(types);
    }
}
