package com.polymarket.edge.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private long nanos;
    private List<Long> sleeps;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        nanos = 0;
        sleeps = new ArrayList<>();
        limiter = new RateLimiter(2.0, 3, () -> nanos, sleeps::add);
    }

    @Test
    void testBurstThenPaced() {
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());

        nanos += TimeUnit.MILLISECONDS.toNanos(500);
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void testAcquireReservesWaitForQueuedCallers() throws InterruptedException {
        for (int i = 0; i < 3; i++) {
            limiter.acquire();
        }
        assertTrue(sleeps.isEmpty());

        limiter.acquire();
        limiter.acquire();

        assertEquals(List.of(TimeUnit.MILLISECONDS.toNanos(500), TimeUnit.SECONDS.toNanos(1)), sleeps);
    }

    @Test
    void testIdlePermitsCappedAtBurst() throws InterruptedException {
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        nanos += TimeUnit.SECONDS.toNanos(10);

        assertEquals(3.0, limiter.availablePermits(), 1e-9);
    }

    @Test
    void testRejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(1, 0));
    }
}
