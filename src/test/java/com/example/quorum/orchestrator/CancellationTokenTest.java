package com.example.quorum.orchestrator;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void testCancelRunsCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void testLateCallbackRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testRemovedCallbackIsSkipped() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        Runnable callback = calls::incrementAndGet;
        token.onCancel(callback);
        token.removeCallback(callback);

        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void testFailingCallbackDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("listener broke");
        });
        token.onCancel(calls::incrementAndGet);

        assertDoesNotThrow(token::cancel);
        assertEquals(1, calls.get());
    }
}
