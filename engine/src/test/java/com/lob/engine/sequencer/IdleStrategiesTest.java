package com.lob.engine.sequencer;

import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.BusySpinIdleStrategy;
import org.agrona.concurrent.YieldingIdleStrategy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdleStrategiesTest {

    @Test
    void knownNames() {
        assertSame(BusySpinIdleStrategy.INSTANCE, IdleStrategies.fromName("busy-spin"));
        assertSame(YieldingIdleStrategy.INSTANCE, IdleStrategies.fromName("yielding"));
        assertInstanceOf(BackoffIdleStrategy.class, IdleStrategies.fromName("backoff"));
    }

    @Test
    void missingNameMeansBackoff() {
        assertInstanceOf(BackoffIdleStrategy.class, IdleStrategies.fromName(null));
    }

    @Test
    void unknownNameIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> IdleStrategies.fromName("sleepy"));
        assertTrue(e.getMessage().contains("sleepy"));
    }
}
