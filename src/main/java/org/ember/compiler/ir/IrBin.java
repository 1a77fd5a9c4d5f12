package org.ember.compiler.ir;

import java.util.List;

/**
 * A binary or bit-string.
 */
public record IrBin(IrAnno anno, List<IrBinElement> elements) implements IrExpr {
    public IrBin {
        elements = List.copyOf(elements);
    }
}
