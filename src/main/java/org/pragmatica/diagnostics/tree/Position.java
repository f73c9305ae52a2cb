package org.pragmatica.diagnostics.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * A position in source text: the input it points into plus an offset.
 *
 * <p>The input is held by reference and never copied. Offsets are indices into the string
 * (UTF-16 code units) and never split a surrogate pair. Two positions are equal only when they
 * point into the same input instance at the same offset.
 */
public record Position(String input, int offset) {

    public Position {
        Objects.requireNonNull(input, "input");
        if (!isValidOffset(input, offset)) {
            throw new IllegalArgumentException("Offset " + offset + " is not a valid position in input of length "
                                               + input.length());
        }
    }

    /**
     * Create a position, or empty if the offset is outside the input or inside a surrogate pair.
     */
    public static Optional<Position> of(String input, int offset) {
        return isValidOffset(input, offset)
               ? Optional.of(new Position(input, offset))
               : Optional.empty();
    }

    public static Position fromStart(String input) {
        return new Position(input, 0);
    }

    public static Position fromEnd(String input) {
        return new Position(input, input.length());
    }

    /**
     * Line and column of this position, both 1-based.
     *
     * <p>{@code \n} and {@code \r\n} end a line; a lone {@code \r} occupies a column. Columns count
     * code points, so a supplementary character advances the column by one.
     */
    public LineColumn lineCol() {
        int line = 1;
        int column = 1;
        int i = 0;

        while (i < offset) {
            char c = input.charAt(i);

            if (c == '\n') {
                line++;
                column = 1;
                i++;
            } else if (c == '\r' && i + 1 < offset && input.charAt(i + 1) == '\n') {
                line++;
                column = 1;
                i += 2;
            } else {
                column++;
                i += Character.charCount(input.codePointAt(i));
            }
        }

        return LineColumn.at(line, column);
    }

    /**
     * Text of the line containing this position, without its line terminator.
     * A position sitting on a terminator belongs to the line that terminator ends.
     */
    public String lineOf() {
        int start = offset == 0 ? 0 : input.lastIndexOf('\n', offset - 1) + 1;
        int end = input.indexOf('\n', offset);

        if (end < 0) {
            end = input.length();
        }
        if (end > start && input.charAt(end - 1) == '\r') {
            end--;
        }
        return input.substring(start, end);
    }

    /**
     * Span from this position to {@code other}, or empty if they belong to different inputs
     * or {@code other} precedes this position.
     */
    public Optional<Span> span(Position other) {
        return Span.of(this, other);
    }

    public boolean sameInput(Position other) {
        return input == other.input;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Position other
               && sameInput(other)
               && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(input) + offset;
    }

    @Override
    public String toString() {
        return lineCol().toString();
    }

    private static boolean isValidOffset(String input, int offset) {
        if (input == null || offset < 0 || offset > input.length()) {
            return false;
        }
        return offset == 0
               || offset == input.length()
               || !(Character.isHighSurrogate(input.charAt(offset - 1)) && Character.isLowSurrogate(input.charAt(offset)));
    }
}
