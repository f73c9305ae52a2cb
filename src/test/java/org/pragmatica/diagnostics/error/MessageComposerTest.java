package org.pragmatica.diagnostics.error;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for message composition from expected and rejected rules.
 */
class MessageComposerTest {

    enum Rule {
        IDENT,
        NUMBER,
        KEYWORD
    }

    @Test
    void bothPresent_unexpectedThenExpected() {
        var message = MessageComposer.compose(List.of(Rule.IDENT, Rule.NUMBER), List.of(Rule.KEYWORD));

        assertEquals("unexpected KEYWORD; expected IDENT or NUMBER", message);
    }

    @Test
    void onlyNegatives() {
        assertEquals("unexpected KEYWORD", MessageComposer.compose(List.of(), List.of(Rule.KEYWORD)));
    }

    @Test
    void onlyPositives() {
        assertEquals("expected IDENT, NUMBER, or KEYWORD",
                     MessageComposer.compose(List.of(Rule.IDENT, Rule.NUMBER, Rule.KEYWORD), List.of()));
    }

    @Test
    void neither_fallsBackToUnknown() {
        assertEquals(MessageComposer.UNKNOWN_ERROR, MessageComposer.compose(List.of(), List.of()));
        assertEquals("unknown parsing error", MessageComposer.compose(List.<Rule>of(), List.<Rule>of(), r -> "x"));
    }

    @Test
    void customRender_usedForBothLists() {
        var message = MessageComposer.compose(List.of(Rule.IDENT),
                                              List.of(Rule.NUMBER),
                                              rule -> rule.name().toLowerCase());

        assertEquals("unexpected number; expected ident", message);
    }
}
