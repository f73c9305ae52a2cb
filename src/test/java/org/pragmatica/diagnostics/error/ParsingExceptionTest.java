package org.pragmatica.diagnostics.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.diagnostics.tree.Position;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParsingExceptionTest {

    private static final String INPUT = "ab\ncd\nef";

    @Test
    void messageIsRenderedReport() {
        var error = ParsingError.parsing(List.of("digit"), List.of(), new Position(INPUT, 4));

        var exception = error.asException();

        assertThat(exception.getMessage()).isEqualTo(error.toString());
        assertThat(exception.getMessage()).endsWith("  = expected digit");
        assertThat(exception.description()).isEqualTo("parsing error");
        assertThat(exception.error()).isSameAs(error);
    }

    @Test
    void canBeThrown() {
        var error = ParsingError.custom("unterminated string", Position.fromEnd(INPUT));

        assertThatThrownBy(() -> {
            throw error.asException();
        })
            .isInstanceOf(ParsingException.class)
            .hasMessageContaining("--> 3:3")
            .hasMessageContaining("= unterminated string");
    }
}
