package com.lob.engine.book;

import com.lob.protocol.OrderType;
import com.lob.protocol.Side;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PoolTest {

    @Test
    void acquireInitialisesAndTracksHighWater() {
        OrderPool pool = new OrderPool(3);
        Order a = pool.acquire(1, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 5);
        Order b = pool.acquire(2, Side.SELL, OrderType.FILL_AND_KILL, 101, 6);

        assertEquals(1, a.id);
        assertEquals(5, a.origQty);
        assertEquals(OrderType.FILL_AND_KILL, b.type);
        assertEquals(2, pool.inUse());

        pool.release(a);
        assertEquals(1, pool.inUse());
        assertEquals(2, pool.highWater());
        assertNull(a.side, "Released orders are wiped");
    }

    @Test
    void exhaustedOrderPoolReturnsNull() {
        OrderPool pool = new OrderPool(1);
        assertNotNull(pool.acquire(1, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 1));
        assertNull(pool.acquire(2, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 1));
        assertEquals(0, pool.available());
    }

    @Test
    void linkedOrderCannotBeReleased() {
        OrderPool pool = new OrderPool(1);
        PriceLevelPool levels = new PriceLevelPool(1);
        Order o = pool.acquire(1, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 1);
        PriceLevel level = levels.open(100);
        level.append(o);

        assertThrows(IllegalStateException.class, () -> pool.release(o));
        assertThrows(IllegalStateException.class, () -> levels.release(level), "Level still holds an order");

        level.unlink(o);
        pool.release(o);
        levels.release(level);
        assertEquals(1, levels.available());
    }

    @Test
    void doubleReleaseOverflows() {
        PriceLevelPool levels = new PriceLevelPool(1);
        PriceLevel level = levels.open(100);
        levels.release(level);
        assertThrows(IllegalStateException.class, () -> levels.release(level));
    }

    @Test
    void doubleReleaseIsCaughtWhileOthersAreOut() {
        OrderPool pool = new OrderPool(3);
        Order a = pool.acquire(1, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 1);
        pool.acquire(2, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 1);

        pool.release(a);
        assertThrows(IllegalStateException.class, () -> pool.release(a));
        assertEquals(2, pool.available(), "Free list holds each instance once");

        PriceLevelPool levels = new PriceLevelPool(2);
        PriceLevel first = levels.open(100);
        levels.open(101);
        levels.release(first);
        assertThrows(IllegalStateException.class, () -> levels.release(first));
        assertEquals(1, levels.available());
    }

    @Test
    void reacquiredInstanceCanBeReleasedAgain() {
        OrderPool pool = new OrderPool(1);
        Order o = pool.acquire(1, Side.SELL, OrderType.GOOD_TILL_CANCEL, 100, 1);
        pool.release(o);
        Order again = pool.acquire(2, Side.SELL, OrderType.GOOD_TILL_CANCEL, 100, 1);
        assertSame(o, again);
        pool.release(again);
        assertEquals(1, pool.available());
    }

    @Test
    void exhaustedLevelPoolThrows() {
        PriceLevelPool levels = new PriceLevelPool(1);
        levels.open(100);
        assertThrows(IllegalStateException.class, () -> levels.open(101));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new OrderPool(0));
    }
}
