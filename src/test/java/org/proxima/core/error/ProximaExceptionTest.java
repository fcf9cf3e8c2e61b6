package org.proxima.core.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reason-coded Exception Tests")
class ProximaExceptionTest {

    @Test
    @DisplayName("Message carries the reason-code prefix")
    void testMessageFormat() {
        ValidationException ex = new ValidationException("X_CODE", "bad input");
        assertEquals("X_CODE", ex.getReasonCode());
        assertEquals("[X_CODE] bad input", ex.getMessage());
        assertInstanceOf(ProximaException.class, ex);
    }

    @Test
    @DisplayName("Cause is chained for persistence failures")
    void testCauseChaining() {
        IllegalStateException cause = new IllegalStateException("db down");
        MessagePersistenceException ex = new MessagePersistenceException("P", "failed", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or null reason codes are rejected")
    void testReasonCodeContract() {
        assertThrows(IllegalArgumentException.class, () -> new NotFoundException(" ", "msg"));
        assertThrows(NullPointerException.class, () -> new NotFoundException(null, "msg"));
        assertThrows(NullPointerException.class, () -> new NotFoundException("CODE", null));
    }
}
