package com.example.quorum.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {

    @Test
    void testDefaultsGrowExponentiallyAndCap() {
        RetryBackoff backoff = RetryBackoff.defaults();

        assertEquals(Duration.ZERO, backoff.delayFor(0));
        assertEquals(Duration.ofMillis(200), backoff.delayFor(1));
        assertEquals(Duration.ofMillis(400), backoff.delayFor(2));
        assertEquals(Duration.ofMillis(800), backoff.delayFor(3));
        assertEquals(Duration.ofSeconds(10), backoff.delayFor(10));
        assertEquals(Duration.ofSeconds(10), backoff.delayFor(500));
    }

    @Test
    void testConstantBackoff() {
        RetryBackoff backoff = new RetryBackoff(Duration.ofMillis(50), 1.0, Duration.ofMillis(50));

        assertEquals(Duration.ofMillis(50), backoff.delayFor(1));
        assertEquals(Duration.ofMillis(50), backoff.delayFor(7));
        assertEquals(Duration.ZERO, RetryBackoff.none().delayFor(3));
    }

    @Test
    void testRejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryBackoff(Duration.ofMillis(-1), 2.0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryBackoff(Duration.ofMillis(10), 0.5, Duration.ofSeconds(1)));
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new RetryBackoff(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1)));
        assertTrue(exception.getMessage().startsWith("retryBackoff.max"));
    }
}
