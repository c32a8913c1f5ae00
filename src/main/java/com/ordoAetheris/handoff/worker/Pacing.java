package com.ordoAetheris.handoff.worker;

import java.time.Duration;
import java.util.concurrent.locks.LockSupport;

final class Pacing {

    private Pacing() {
    }

    // Throughput knob only, never needed for correctness.
    static void pause(Duration delay) {
        if (delay.isZero()) return;
        LockSupport.parkNanos(delay.toNanos());
    }

    static Duration check(Duration delay) {
        if (delay == null) throw new IllegalArgumentException("pacing must not be null");
        if (delay.isNegative()) throw new IllegalArgumentException("pacing must be >= 0, got " + delay);
        return delay;
    }
}
