package org.ember.compiler.api;

import org.ember.compiler.frontend.ast.AstNode;

import java.util.List;

/**
 * Defines the public interface of the expansion and lowering core.
 */
public interface ICompiler {

    /**
     * Expands and lowers the given top-level forms.
     *
     * @param forms    The parsed top-level forms of one compilation unit.
     * @param fileName The file the forms were read from, used for diagnostics.
     * @return A {@link LoweredProgram} containing the lowered forms and the warnings raised on the way.
     * @throws CompilationException if a compile error aborts the unit.
     */
    LoweredProgram compile(List<AstNode> forms, String fileName) throws CompilationException;

    /**
     * Expands and lowers a single top-level form.
     *
     * @param form     The parsed form.
     * @param fileName The file the form was read from.
     * @return A {@link LoweredProgram} holding one lowered form.
     * @throws CompilationException if a compile error aborts the unit.
     */
    default LoweredProgram compile(AstNode form, String fileName) throws CompilationException {
        return compile(List.of(form), fileName);
    }
}
