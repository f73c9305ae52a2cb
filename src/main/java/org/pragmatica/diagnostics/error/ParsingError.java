package org.pragmatica.diagnostics.error;

import org.pragmatica.diagnostics.report.ReportConfig;
import org.pragmatica.diagnostics.report.ReportRenderer;
import org.pragmatica.diagnostics.tree.LineColumn;
import org.pragmatica.diagnostics.tree.Position;
import org.pragmatica.diagnostics.tree.Span;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Parse failure anchored in the source text.
 *
 * <p>Exactly one of three shapes is active: rule attempts reported by the matcher, or a custom
 * message at a position or over a span. {@link #toString()} renders the full report:
 * <pre>
 *  --> 2:2
 *   |
 * 2 | cd
 *   |  ^---
 *   |
 *   = unexpected 4, 5, or 6; expected 1, 2, or 3
 * </pre>
 *
 * @param <R> rule identifier type; rendered with {@code toString()} unless renamed
 */
public sealed interface ParsingError<R> {

    /**
     * Dispatch on the active shape.
     */
    <T> T fold(Function<? super Attempts<R>, ? extends T> onAttempts,
               Function<? super PositionedMessage<R>, ? extends T> onPositioned,
               Function<? super SpannedMessage<R>, ? extends T> onSpanned);

    /**
     * Error generated by the matcher from the rules attempted at the deepest position.
     */
    static <R> ParsingError<R> parsing(List<R> positives, List<R> negatives, Position position) {
        return new Attempts<>(positives, negatives, position);
    }

    /**
     * Custom error with a message at a position.
     */
    static <R> ParsingError<R> custom(String message, Position position) {
        return new PositionedMessage<>(message, position);
    }

    /**
     * Custom error with a message over a span.
     */
    static <R> ParsingError<R> custom(String message, Span span) {
        return new SpannedMessage<>(message, span);
    }

    /**
     * Replace rule identifiers with display names.
     *
     * <p>Attempts become a {@link PositionedMessage} at the same position with the message built
     * from {@code renderRule}. Custom errors are returned unchanged.
     */
    default ParsingError<R> renamedRules(Function<? super R, String> renderRule) {
        return this.<ParsingError<R>>fold(attempts -> ParsingError.<R>custom(MessageComposer.compose(attempts.positives(),
                                                                                                     attempts.negatives(),
                                                                                                     renderRule),
                                                                             attempts.position()),
                                          positioned -> positioned,
                                          spanned -> spanned);
    }

    /**
     * Message shown in the last row of the report.
     */
    default String message() {
        return fold(attempts -> MessageComposer.compose(attempts.positives(), attempts.negatives()),
                    PositionedMessage::message,
                    SpannedMessage::message);
    }

    /**
     * Short description: "parsing error" for attempts, the message for custom errors.
     */
    default String description() {
        return fold(attempts -> "parsing error",
                    PositionedMessage::message,
                    SpannedMessage::message);
    }

    /**
     * Position the report is keyed to. Spanned errors use the start of the span.
     */
    default Position anchor() {
        return fold(Attempts::position,
                    PositionedMessage::position,
                    spanned -> spanned.span().start());
    }

    default LineColumn lineCol() {
        return anchor().lineCol();
    }

    /**
     * Render the report with the given options. {@code toString()} renders with defaults.
     */
    default String render(ReportConfig config) {
        return ReportRenderer.render(this, config);
    }

    default ParsingException asException() {
        return new ParsingException(this);
    }

    /**
     * Rules expected ({@code positives}) and rejected ({@code negatives}) at the deepest position
     * the matcher reached. Order is preserved as reported.
     */
    record Attempts<R>(List<R> positives, List<R> negatives, Position position) implements ParsingError<R> {
        public Attempts {
            positives = List.copyOf(positives);
            negatives = List.copyOf(negatives);
            Objects.requireNonNull(position, "position");
        }

        @Override
        public <T> T fold(Function<? super Attempts<R>, ? extends T> onAttempts,
                          Function<? super PositionedMessage<R>, ? extends T> onPositioned,
                          Function<? super SpannedMessage<R>, ? extends T> onSpanned) {
            return onAttempts.apply(this);
        }

        @Override
        public String toString() {
            return ReportRenderer.render(this);
        }
    }

    record PositionedMessage<R>(String message, Position position) implements ParsingError<R> {
        public PositionedMessage {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(position, "position");
        }

        @Override
        public <T> T fold(Function<? super Attempts<R>, ? extends T> onAttempts,
                          Function<? super PositionedMessage<R>, ? extends T> onPositioned,
                          Function<? super SpannedMessage<R>, ? extends T> onSpanned) {
            return onPositioned.apply(this);
        }

        @Override
        public String toString() {
            return ReportRenderer.render(this);
        }
    }

    record SpannedMessage<R>(String message, Span span) implements ParsingError<R> {
        public SpannedMessage {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public <T> T fold(Function<? super Attempts<R>, ? extends T> onAttempts,
                          Function<? super PositionedMessage<R>, ? extends T> onPositioned,
                          Function<? super SpannedMessage<R>, ? extends T> onSpanned) {
            return onSpanned.apply(this);
        }

        @Override
        public String toString() {
            return ReportRenderer.render(this);
        }
    }
}
