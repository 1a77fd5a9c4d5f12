package org.ember.compiler.api;

/**
 * An exception that is thrown when one or more errors occur while expanding or lowering a compilation unit.
 * <p>
 * It is part of the public API and hides the internal {@code CompileError} of the compiler.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode code;

    /**
     * Constructs a new compilation exception with the specified detail message, error code and cause.
     * @param message The detail message.
     * @param code The code of the error that aborted the unit.
     * @param cause The cause.
     */
    public CompilationException(String message, CompilerErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return The code of the error that aborted the compilation unit.
     */
    public CompilerErrorCode code() {
        return code;
    }
}
