package com.lob.engine.book;

import com.lob.protocol.OrderType;
import com.lob.protocol.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceLevelTest {

    private PriceLevel level;
    private Order a, b, c;

    @BeforeEach
    void setUp() {
        level = new PriceLevel();
        level.open(100);
        a = order(1, 5);
        b = order(2, 7);
        c = order(3, 11);
        level.append(a);
        level.append(b);
        level.append(c);
    }

    @Test
    void keepsArrivalOrder() {
        assertSame(a, level.head);
        assertSame(b, a.next);
        assertSame(c, level.tail);
        assertEquals(23, level.totalQty);
        assertEquals(3, level.orderCount);
    }

    @Test
    void removeFromMiddleHeadAndTail() {
        level.unlink(b);
        assertSame(c, a.next);
        assertSame(a, c.prev);
        assertNull(b.level);

        level.unlink(a);
        assertSame(c, level.head);

        level.unlink(c);
        assertTrue(level.isEmpty());
        assertNull(level.tail);
        assertEquals(0, level.totalQty);
        assertEquals(0, level.orderCount);
    }

    @Test
    void removingForeignOrderFails() {
        Order stranger = order(9, 1);
        assertThrows(IllegalStateException.class, () -> level.unlink(stranger));
        assertEquals(3, level.orderCount);
    }

    @Test
    void orderAtAnotherPriceIsRefused() {
        Order wrong = new Order();
        wrong.init(9, Side.BUY, OrderType.GOOD_TILL_CANCEL, 101, 1);
        assertThrows(IllegalStateException.class, () -> level.append(wrong));
        assertThrows(IllegalStateException.class, () -> level.append(a), "Already queued");
        assertEquals(3, level.orderCount);
    }

    private static Order order(long id, long qty) {
        Order o = new Order();
        o.init(id, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, qty);
        return o;
    }
}
