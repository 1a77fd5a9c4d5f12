package org.ember.compiler.ir;

/**
 * One association of an {@link IrMap}.
 *
 * @param anno  The annotation.
 * @param kind  {@code =>} or {@code :=}.
 * @param key   The key.
 * @param value The value.
 */
public record IrMapField(IrAnno anno, Kind kind, IrExpr key, IrExpr value) {

    public enum Kind {
        /** {@code =>}: inserts or replaces. */
        ASSOC("=>"),
        /** {@code :=}: requires the key to exist. */
        EXACT(":=");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
