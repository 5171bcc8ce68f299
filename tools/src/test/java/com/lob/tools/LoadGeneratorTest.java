package com.lob.tools;

import com.lob.common.EngineConfig;
import com.lob.protocol.LevelInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoadGeneratorTest {

    private static EngineConfig smallConfig() {
        EngineConfig cfg = EngineConfig.defaults();
        cfg.orderPoolSize = 20_000;
        cfg.levelPoolSize = 1_000;
        cfg.commandQueueCapacity = 4_096;
        cfg.idleStrategy = "yielding";
        return cfg;
    }

    @Test
    void runLeavesAConsistentBook() throws Exception {
        LoadGenerator.Result r = new LoadGenerator(smallConfig(), 20_000, 42L).run();

        assertEquals(20_000, r.commands);
        assertTrue(r.trades > 0, "Prices straddle the mid, so orders must cross");
        assertTrue(r.tradedQty >= r.trades);

        long restingQty = 0;
        for (LevelInfo l : r.book.bids()) restingQty += l.quantity();
        for (LevelInfo l : r.book.asks()) restingQty += l.quantity();
        assertTrue(r.resting > 0);
        assertTrue(restingQty >= r.resting, "Every resting order holds at least one lot");

        if (!r.book.bids().isEmpty() && !r.book.asks().isEmpty()) {
            assertTrue(r.book.bids().get(0).price() < r.book.asks().get(0).price());
        }
        assertTrue(r.rttMicros(50) > 0);
    }

    @Test
    void sameSeedSameOutcome() throws Exception {
        LoadGenerator.Result a = new LoadGenerator(smallConfig(), 5_000, 7L).run();
        LoadGenerator.Result b = new LoadGenerator(smallConfig(), 5_000, 7L).run();

        assertEquals(a.trades, b.trades);
        assertEquals(a.tradedQty, b.tradedQty);
        assertEquals(a.book, b.book);
    }
}
