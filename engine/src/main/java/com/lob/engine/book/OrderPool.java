package com.lob.engine.book;

import com.lob.protocol.OrderType;
import com.lob.protocol.Side;

/** Orders for one book, handed out already initialised. */
public final class OrderPool extends FixedPool<Order> {

    public OrderPool(int capacity) {
        super(capacity, () -> {
            Order o = new Order();
            o.pooled = true;
            return o;
        });
    }

    /** @return a fresh unlinked order, or null if the pool is exhausted */
    public Order acquire(long id, Side side, OrderType type, long price, long qty) {
        Order o = take();
        if (o != null) {
            o.pooled = false;
            o.init(id, side, type, price, qty);
        }
        return o;
    }

    /** Return an order that has left the book. It must already be unlinked from its level. */
    public void release(Order o) {
        if (o.pooled) {
            throw new IllegalStateException("Order released twice: " + o);
        }
        if (o.level != null) {
            throw new IllegalStateException("Released order is still linked at " + o.level.price + ": " + o);
        }
        o.reset();
        o.pooled = true;
        giveBack(o);
    }
}
