package com.ordoAetheris.handoff;

import java.time.Duration;

/**
 * Outcome of a completed transfer.
 */
public final class TransferResult {

    private final int produced;
    private final int consumed;
    private final Duration elapsed;

    public TransferResult(int produced, int consumed, Duration elapsed) {
        this.produced = produced;
        this.consumed = consumed;
        this.elapsed = elapsed;
    }

    public int produced() {
        return produced;
    }

    public int consumed() {
        return consumed;
    }

    public Duration elapsed() {
        return elapsed;
    }

    /** True when every enqueued item reached the sink. */
    public boolean isBalanced() {
        return produced == consumed;
    }

    @Override
    public String toString() {
        return String.format("TransferResult{produced=%d, consumed=%d, elapsed=%dms}",
                produced, consumed, elapsed.toMillis());
    }
}
