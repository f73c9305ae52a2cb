package org.pragmatica.diagnostics.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 * Both bounds point into the same input instance.
 */
public record Span(Position start, Position end) {

    public Span {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!isOrdered(start, end)) {
            throw new IllegalArgumentException("Span bounds must share an input and be ordered, got "
                                               + start.offset() + ".." + end.offset());
        }
    }

    public static Optional<Span> of(Position start, Position end) {
        return isOrdered(start, end)
               ? Optional.of(new Span(start, end))
               : Optional.empty();
    }

    public static Optional<Span> of(String input, int start, int end) {
        return Position.of(input, start)
                       .flatMap(from -> Position.of(input, end)
                                                .flatMap(to -> of(from, to)));
    }

    public static Span at(Position position) {
        return new Span(position, position);
    }

    /**
     * Distance between the bounds in offsets.
     */
    public int width() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return width() == 0;
    }

    public String asString() {
        return start.input().substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }

    private static boolean isOrdered(Position start, Position end) {
        return start != null
               && end != null
               && start.sameInput(end)
               && start.offset() <= end.offset();
    }
}
