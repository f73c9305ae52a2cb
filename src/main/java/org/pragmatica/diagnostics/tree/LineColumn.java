package org.pragmatica.diagnostics.tree;

/**
 * A resolved position in source text (line and column, both 1-based).
 */
public record LineColumn(int line, int column) {

    public static final LineColumn START = new LineColumn(1, 1);

    public LineColumn {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column are 1-based, got " + line + ":" + column);
        }
    }

    public static LineColumn at(int line, int column) {
        return new LineColumn(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
