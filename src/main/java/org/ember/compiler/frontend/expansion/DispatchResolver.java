package org.ember.compiler.frontend.expansion;

import org.ember.compiler.frontend.ast.Meta;

import java.util.Optional;

/**
 * Decides whether a name used in a capture refers to a function that can be referenced directly.
 * An empty answer means the capture has to be compiled into a function literal.
 */
public interface DispatchResolver {

    /**
     * Resolves an unqualified name.
     *
     * @param meta  The call metadata, possibly carrying {@link Meta#IMPORT} and {@link Meta#CONTEXT}.
     * @param name  The function name.
     * @param arity The arity.
     * @param env   The compilation environment.
     * @return A {@link CaptureResult.LocalRef} or {@link CaptureResult.RemoteRef}, or empty.
     */
    Optional<CaptureResult> resolveImport(Meta meta, String name, int arity, Environment env);

    /**
     * Resolves a name qualified by a module.
     *
     * @param meta   The call metadata.
     * @param module The module name.
     * @param name   The function name.
     * @param arity  The arity.
     * @param env    The compilation environment.
     * @return A {@link CaptureResult.RemoteRef}, or empty.
     */
    Optional<CaptureResult> resolveRequire(Meta meta, String module, String name, int arity, Environment env);
}
