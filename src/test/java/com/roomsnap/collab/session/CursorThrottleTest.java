package com.roomsnap.collab.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.roomsnap.collab.testing.MutableClock;
import org.junit.jupiter.api.Test;

class CursorThrottleTest {
    @Test
    void burstWithinOneIntervalPassesOnce() {
        MutableClock clock = new MutableClock(1000);
        CursorThrottle throttle = new CursorThrottle(clock, 100);

        int passed = 0;
        for (int i = 0; i < 10; i++) {
            if (throttle.tryAcquire()) {
                passed++;
            }
            clock.advance(9);
        }

        assertEquals(1, passed);
    }

    @Test
    void opensAgainAfterTheInterval() {
        MutableClock clock = new MutableClock(1000);
        CursorThrottle throttle = new CursorThrottle(clock, 100);
        assertTrue(throttle.tryAcquire());

        clock.advance(99);
        assertFalse(throttle.tryAcquire());
        clock.advance(1);
        assertTrue(throttle.tryAcquire());
    }

    @Test
    void resetOpensImmediately() {
        CursorThrottle throttle = new CursorThrottle(new MutableClock(1000), 100);
        throttle.tryAcquire();

        throttle.reset();

        assertTrue(throttle.tryAcquire());
    }
}
