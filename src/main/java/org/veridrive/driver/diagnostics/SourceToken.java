package org.veridrive.driver.diagnostics;

/**
 * A source position as reported by the proof engine. Columns are 1-based in the engine's
 * convention. A token produced for an inlined or instantiated construct carries the position it
 * originated from as {@code inner}; that origin may itself be nested.
 *
 * @param fileName The file name.
 * @param line     The 1-based line.
 * @param column   The column.
 * @param inner    The nested origin, or {@code null}.
 */
public record SourceToken(String fileName, int line, int column, SourceToken inner) {

    public static SourceToken at(String fileName, int line, int column) {
        return new SourceToken(fileName, line, column, null);
    }

    public static SourceToken nested(SourceToken outer, SourceToken inner) {
        return new SourceToken(outer.fileName(), outer.line(), outer.column(), inner);
    }

    public SourceToken withColumn(int newColumn) {
        return new SourceToken(fileName, line, newColumn, inner);
    }

    public boolean isNested() {
        return inner != null;
    }
}
