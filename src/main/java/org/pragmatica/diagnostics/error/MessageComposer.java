package org.pragmatica.diagnostics.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Builds the message of a parsing error from the rules the matcher expected and rejected.
 */
public final class MessageComposer {
    private static final Logger log = LoggerFactory.getLogger(MessageComposer.class);

    public static final String UNKNOWN_ERROR = "unknown parsing error";

    private MessageComposer() {}

    /**
     * Compose the message with each rule rendered by its {@code toString()}.
     */
    public static <R> String compose(List<? extends R> positives, List<? extends R> negatives) {
        return compose(positives, negatives, String::valueOf);
    }

    /**
     * Compose "unexpected ...; expected ..." message.
     *
     * @param positives rules expected at the failure position
     * @param negatives rules that matched but must not have
     * @param render    display name of a rule
     */
    public static <R> String compose(List<? extends R> positives,
                                     List<? extends R> negatives,
                                     Function<? super R, String> render) {
        if (!negatives.isEmpty() && !positives.isEmpty()) {
            return "unexpected " + ListEnumerator.enumerate(negatives, render)
                   + "; expected " + ListEnumerator.enumerate(positives, render);
        }
        if (!negatives.isEmpty()) {
            return "unexpected " + ListEnumerator.enumerate(negatives, render);
        }
        if (!positives.isEmpty()) {
            return "expected " + ListEnumerator.enumerate(positives, render);
        }

        log.debug("Parsing error carries no attempted rules");
        return UNKNOWN_ERROR;
    }
}
