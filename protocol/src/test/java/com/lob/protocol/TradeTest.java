package com.lob.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TradeTest {

    @Test
    void legsKeepTheirOwnPrices() {
        Trade t = Trade.of(1, 105, 2, 100, 7);
        assertEquals(new TradeInfo(1, 105, 7), t.bid());
        assertEquals(new TradeInfo(2, 100, 7), t.ask());
        assertEquals(7, t.quantity());
    }

    @Test
    void mismatchedQuantitiesAreALogicError() {
        assertThrows(IllegalStateException.class,
                () -> new Trade(new TradeInfo(1, 100, 5), new TradeInfo(2, 100, 4)));
    }

    @Test
    void nullLegIsRefused() {
        assertThrows(NullPointerException.class, () -> new Trade(null, new TradeInfo(2, 100, 4)));
    }
}
