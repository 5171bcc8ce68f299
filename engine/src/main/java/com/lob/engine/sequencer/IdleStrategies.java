package com.lob.engine.sequencer;

import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.BusySpinIdleStrategy;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.YieldingIdleStrategy;

import java.util.concurrent.TimeUnit;

/** Maps the {@code idleStrategy} config value onto an Agrona {@link IdleStrategy}. */
public final class IdleStrategies {
    private IdleStrategies() {}

    public static IdleStrategy fromName(String name) {
        switch (name == null ? "backoff" : name) {
            case "busy-spin": return BusySpinIdleStrategy.INSTANCE;
            case "yielding":  return YieldingIdleStrategy.INSTANCE;
            case "backoff":
                return new BackoffIdleStrategy(100, 10,
                        TimeUnit.MICROSECONDS.toNanos(1), TimeUnit.MILLISECONDS.toNanos(1));
            default: throw new IllegalArgumentException("Unknown idle strategy: " + name);
        }
    }
}
