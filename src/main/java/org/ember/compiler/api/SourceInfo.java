package org.ember.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number, or 0 when the node carries no position.
 */
public record SourceInfo(String fileName, int lineNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
