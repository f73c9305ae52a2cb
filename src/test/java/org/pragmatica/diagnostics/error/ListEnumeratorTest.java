package org.pragmatica.diagnostics.error;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListEnumeratorTest {

    @Test
    void singleItem_hasNoConnective() {
        assertThat(ListEnumerator.enumerate(List.of("ident"), String::valueOf)).isEqualTo("ident");
    }

    @Test
    void twoItems_joinedWithOrWithoutComma() {
        assertThat(ListEnumerator.enumerate(List.of("a", "b"), String::valueOf)).isEqualTo("a or b");
    }

    @Test
    void threeItems_useSerialComma() {
        assertThat(ListEnumerator.enumerate(List.of(1, 2, 3), String::valueOf)).isEqualTo("1, 2, or 3");
    }

    @Test
    void manyItems_commaSeparatedPrefix() {
        assertThat(ListEnumerator.enumerate(List.of("a", "b", "c", "d", "e"), String::valueOf))
            .isEqualTo("a, b, c, d, or e");
    }

    @Test
    void renderIsAppliedToEveryItem() {
        assertThat(ListEnumerator.enumerate(List.of(1, 2, 3), n -> "<" + n + ">"))
            .isEqualTo("<1>, <2>, or <3>");
    }

    @Test
    void duplicatesArePreservedInOrder() {
        assertThat(ListEnumerator.enumerate(List.of("b", "a", "b"), String::valueOf))
            .isEqualTo("b, a, or b");
    }

    @Test
    void emptyList_isRejected() {
        assertThatThrownBy(() -> ListEnumerator.enumerate(List.of(), String::valueOf))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
