package org.ember.compiler.diagnostics;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.api.SourceInfo;

/**
 * Aborts the expansion or lowering of the current unit. Thrown from the point of detection and
 * converted into a {@link org.ember.compiler.api.CompilationException} by the compiler facade.
 */
public final class CompileError extends RuntimeException {

    private final CompilerErrorCode code;
    private final SourceInfo source;

    /**
     * Constructs a new compile error.
     * @param code The error code.
     * @param source The location the error refers to.
     * @param message The formatted message.
     */
    public CompileError(CompilerErrorCode code, SourceInfo source, String message) {
        super(message);
        this.code = code;
        this.source = source;
    }

    /**
     * Formats a diagnostic and throws it. Never returns normally; the return type only lets callers
     * write {@code throw CompileError.raise(...)} where the compiler needs a terminating statement.
     *
     * @param line The line the error refers to.
     * @param file The file of the current unit.
     * @param code The error code.
     * @param format A {@link String#format} pattern.
     * @param args The pattern arguments.
     * @return never returns
     */
    public static CompileError raise(int line, String file, CompilerErrorCode code, String format, Object... args) {
        throw new CompileError(code, new SourceInfo(file, line), String.format(format, args));
    }

    public CompilerErrorCode code() {
        return code;
    }

    public SourceInfo source() {
        return source;
    }

    @Override
    public String toString() {
        return source + ": " + getMessage();
    }
}
