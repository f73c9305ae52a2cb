package org.pragmatica.diagnostics.report;

import java.util.Objects;
import java.util.Optional;

/**
 * Report rendering options.
 *
 * @param path name of the input shown in the report header, e.g. {@code --> grammar.peg:2:2}
 */
public record ReportConfig(Optional<String> path) {
    public static final ReportConfig DEFAULT = new ReportConfig(Optional.empty());

    public ReportConfig {
        Objects.requireNonNull(path, "path");
    }

    public ReportConfig withPath(String path) {
        return new ReportConfig(Optional.of(path));
    }
}
