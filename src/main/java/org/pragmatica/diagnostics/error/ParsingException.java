package org.pragmatica.diagnostics.error;

import java.util.Objects;

/**
 * Unchecked exception carrying a {@link ParsingError}, for call sites that have to throw.
 * The exception message is the rendered report.
 */
public final class ParsingException extends RuntimeException {
    private final transient ParsingError<?> error;

    public ParsingException(ParsingError<?> error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public ParsingError<?> error() {
        return error;
    }

    public String description() {
        return error.description();
    }
}
