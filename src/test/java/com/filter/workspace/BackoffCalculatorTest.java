package com.filter.workspace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffCalculatorTest {

    @Test
    @DisplayName("delay doubles per retry without jitter")
    void exponential() {
        var backoff = new BackoffCalculator(500, 10_000, 0.0);
        assertEquals(500, backoff.delayBefore(1));
        assertEquals(1000, backoff.delayBefore(2));
        assertEquals(2000, backoff.delayBefore(3));
    }

    @Test
    @DisplayName("delay is capped at the maximum, even for huge retry numbers")
    void capped() {
        var backoff = new BackoffCalculator(500, 3_000, 0.0);
        assertEquals(3000, backoff.delayBefore(4));
        assertEquals(3000, backoff.delayBefore(1000));
    }

    @Test
    @DisplayName("jitter stays within the configured factor")
    void jitterBounds() {
        var backoff = new BackoffCalculator(1000, 100_000, 0.1);
        for (int i = 0; i < 50; i++) {
            long delay = backoff.delayBefore(1);
            assertTrue(delay >= 1000 && delay <= 1100, "delay " + delay);
        }
    }

    @Test
    @DisplayName("invalid arguments are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(0, 10, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(100, 10, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(10, 100, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(10, 100, 0.1).delayBefore(0));
    }
}
