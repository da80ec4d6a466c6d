package com.ryuqq.urengine.core.outcome;

import com.ryuqq.urengine.core.orchestration.ExecStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome sealed 계층 테스트.
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_StatusIsSuccess() {
        // When
        Outcome outcome = Ok.of("done");

        // Then
        assertTrue(outcome.isOk());
        assertEquals(ExecStatus.SUCCESS, outcome.status());
        assertTrue(ExecStatus.isSuccess(outcome.status()));
    }

    @Test
    void retry_ZeroStatus_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Retry(0, "later"));
    }

    @Test
    void retry_BlankReason_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Retry(1, " "));
    }

    @Test
    void fail_KeepsStatusAndCode() {
        // When
        Fail fail = Fail.of(ExecStatus.ADAPTER_FAILURE, "E_IO", "unreadable");

        // Then
        assertTrue(fail.isFail());
        assertFalse(fail.isRetry());
        assertEquals(-2, fail.status());
        assertEquals("E_IO", fail.errorCode());
    }

    @Test
    void fail_ZeroStatus_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(0, "E", "m"));
    }

    @Test
    void instanceofChain_CoversAllVariants() {
        // Given
        Outcome[] outcomes = {Ok.empty(), new Retry(1, "later"), Fail.of(2, "E", "m")};

        // When
        StringBuilder kinds = new StringBuilder();
        for (Outcome outcome : outcomes) {
            if (outcome instanceof Ok) {
                kinds.append("ok ");
            } else if (outcome instanceof Retry retry) {
                kinds.append("retry:").append(retry.reason()).append(' ');
            } else if (outcome instanceof Fail fail) {
                kinds.append("fail:").append(fail.errorCode());
            }
        }

        // Then
        assertEquals("ok retry:later fail:E", kinds.toString());
    }
}
