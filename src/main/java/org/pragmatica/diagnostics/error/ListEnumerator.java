package org.pragmatica.diagnostics.error;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a list of items as an English enumeration: {@code a}, {@code a or b},
 * {@code a, b, or c}.
 */
public final class ListEnumerator {
    private ListEnumerator() {}

    /**
     * Enumerate non-empty list of items.
     *
     * @param items  items in display order
     * @param render textual form of a single item
     * @return enumeration with "or" before the last item
     * @throws IllegalArgumentException if {@code items} is empty
     */
    public static <T> String enumerate(List<? extends T> items, Function<? super T, String> render) {
        return switch (items.size()) {
            case 0 -> throw new IllegalArgumentException("Nothing to enumerate");
            case 1 -> render.apply(items.get(0));
            case 2 -> render.apply(items.get(0)) + " or " + render.apply(items.get(1));
            default -> enumerateMany(items, render);
        };
    }

    private static <T> String enumerateMany(List<? extends T> items, Function<? super T, String> render) {
        var last = items.size() - 1;
        var head = items.subList(0, last)
                        .stream()
                        .map(render)
                        .collect(Collectors.joining(", "));

        return head + ", or " + render.apply(items.get(last));
    }
}
