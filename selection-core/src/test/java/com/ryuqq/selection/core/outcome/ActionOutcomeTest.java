package com.ryuqq.selection.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ActionOutcome (Ok / Retry / Fail) 테스트.
 *
 * @author Selection Team
 * @since 1.0.0
 */
class ActionOutcomeTest {

    @Test
    void ok_TypeChecks() {
        ActionOutcome outcome = Ok.of();

        assertTrue(outcome.isOk());
        assertFalse(outcome.isRetry());
        assertFalse(outcome.isFail());
        assertSame(Ok.of(), Ok.of());
        assertEquals("done", Ok.of("done").message());
    }

    @Test
    void retry_DefaultsToNoHint() {
        Retry retry = Retry.of("rate limited");

        assertTrue(retry.isRetry());
        assertEquals(0, retry.retryAfterMillis());
    }

    @Test
    void retry_InvalidArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> Retry.of(" "));
        assertThrows(IllegalArgumentException.class, () -> new Retry("busy", -1));
    }

    @Test
    void fail_KeepsErrorDetails() {
        Fail fail = Fail.of("REPLY-409", "already replied", "conflict");

        assertTrue(fail.isFail());
        assertEquals("REPLY-409", fail.errorCode());
        assertEquals("already replied", fail.message());
        assertEquals("conflict", fail.cause());
        assertNull(Fail.of("REPLY-409", "already replied").cause());
    }

    @Test
    void fail_BlankCodeOrMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(null, "m"));
        assertThrows(IllegalArgumentException.class, () -> Fail.of("E", " "));
    }

    @Test
    void instanceofDispatch_CoversAllOutcomes() {
        ActionOutcome[] outcomes = {Ok.of(), Retry.of("later"), Fail.of("E", "m")};
        int handled = 0;

        for (ActionOutcome outcome : outcomes) {
            if (outcome instanceof Ok) {
                handled++;
            } else if (outcome instanceof Retry) {
                handled++;
            } else if (outcome instanceof Fail) {
                handled++;
            }
        }

        assertEquals(3, handled);
    }
}
