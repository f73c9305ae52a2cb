package org.pragmatica.diagnostics.report;

import org.pragmatica.diagnostics.error.ParsingError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link ParsingError} as a source-anchored report.
 *
 * <p>Example output:
 * <pre>
 *  --> 2:2
 *   |
 * 2 | cd
 *   |  ^---
 *   |
 *   = expected 1 or 2
 * </pre>
 * The gutter is as wide as the line number. Point errors are marked with {@code ^---};
 * span errors are underlined across the span width.
 */
public final class ReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(ReportRenderer.class);

    public static final String POINT_MARKER = "^---";

    private ReportRenderer() {}

    public static String render(ParsingError<?> error) {
        return render(error, ReportConfig.DEFAULT);
    }

    /**
     * Render the report, six lines without trailing newline.
     */
    public static String render(ParsingError<?> error, ReportConfig config) {
        var anchor = error.anchor();
        var location = anchor.lineCol();
        var lineNumber = String.valueOf(location.line());
        var gutter = " ".repeat(lineNumber.length());

        log.trace("Rendering report at {}", location);

        var header = config.path()
                           .map(path -> path + ":" + location)
                           .orElseGet(location::toString);

        return String.join("\n",
                           gutter + "--> " + header,
                           gutter + " |",
                           lineNumber + " | " + anchor.lineOf(),
                           gutter + " | " + underline(error, location.column() - 1),
                           gutter + " |",
                           gutter + " = " + error.message());
    }

    /**
     * Underline preceded by {@code offset} spaces.
     *
     * @param offset zero-based column of the anchor
     */
    public static String underline(ParsingError<?> error, int offset) {
        return " ".repeat(offset) + error.fold(attempts -> POINT_MARKER,
                                               positioned -> POINT_MARKER,
                                               spanned -> spanMarker(spanned.span().width()));
    }

    private static String spanMarker(int width) {
        if (width > 1) {
            return "^" + "-".repeat(width - 2) + "^";
        }
        return "^";
    }
}
