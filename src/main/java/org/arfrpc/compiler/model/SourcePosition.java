package org.arfrpc.compiler.model;

/**
 * A {@code (line, column)} location inside a named source file.
 *
 * @param fileName The logical file name (normalized path).
 * @param line     The 1-based line.
 * @param column   The 1-based column.
 */
public record SourcePosition(String fileName, int line, int column) {

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
