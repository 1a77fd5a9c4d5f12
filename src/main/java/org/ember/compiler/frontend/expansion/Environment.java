package org.ember.compiler.frontend.expansion;

import org.ember.compiler.config.CompilerConfig;

/**
 * Read-only context of one compilation unit.
 *
 * @param file    The file being compiled, used in diagnostics.
 * @param module  The module the unit belongs to.
 * @param config  The compiler configuration, including the function tables.
 * @param counter The source of fresh identifiers.
 */
public record Environment(String file, String module, CompilerConfig config, UniqueCounter counter) {

    /**
     * @param file   The file being compiled.
     * @param config The compiler configuration.
     * @return An environment for the configured module with a fresh counter.
     */
    public static Environment of(String file, CompilerConfig config) {
        return new Environment(file, config.module(), config, new UniqueCounter());
    }
}
