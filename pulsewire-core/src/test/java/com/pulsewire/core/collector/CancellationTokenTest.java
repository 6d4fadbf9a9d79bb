package com.pulsewire.core.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CancellationToken.
 */
class CancellationTokenTest {

    @Test
    @DisplayName("Should run each callback once and keep the first reason")
    void cancelOnce() {
        // Given
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        // When
        token.cancel("timeout");
        token.cancel("deadline");

        // Then
        assertTrue(token.isCancelled());
        assertEquals("timeout", token.reason());
        assertEquals(1, calls.get());
        CancellationException e = assertThrows(CancellationException.class, token::throwIfCancelled);
        assertEquals("timeout", e.getMessage());
    }

    @Test
    @DisplayName("Should run late registrations immediately")
    void lateRegistration() {
        CancellationToken token = new CancellationToken();
        token.cancel("done");
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should not run deregistered callbacks")
    void deregister() {
        // Given
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();

        // When
        try (CancellationToken.Registration ignored = token.onCancel(calls::incrementAndGet)) {
            assertFalse(token.isCancelled());
        }
        token.cancel("later");

        // Then
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("Should keep running callbacks after one fails")
    void failingCallback() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel("x");

        assertEquals(1, calls.get());
        assertDoesNotThrow(new CancellationToken()::throwIfCancelled);
    }
}
