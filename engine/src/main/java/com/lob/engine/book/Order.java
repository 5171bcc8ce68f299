package com.lob.engine.book;

import com.lob.protocol.OrderState;
import com.lob.protocol.OrderType;
import com.lob.protocol.Side;

/**
 * A limit order owned by the book. Instances are obtained from {@link OrderPool}.
 * Fields are read directly; remaining quantity only changes through {@link #fill(long)}.
 */
public final class Order {

    public long      id;         // caller-assigned, treated as unsigned
    public Side      side;
    public OrderType type;
    public long      price;      // ticks
    public long      qty;        // remaining quantity
    public long      origQty;

    // Intrusive doubly-linked list within a PriceLevel
    public Order prev;
    public Order next;

    // Back-pointer to the level this order belongs to (for O(1) cancel)
    public PriceLevel level;

    // True while sitting in an OrderPool free list
    boolean pooled;

    void init(long id, Side side, OrderType type, long price, long qty) {
        this.id = id;
        this.side = side;
        this.type = type;
        this.price = price;
        this.qty = qty;
        this.origQty = qty;
    }

    /**
     * Apply an execution. Filling more than the remaining quantity means the
     * matching loop is broken, so it fails instead of clamping.
     */
    public void fill(long fillQty) {
        if (fillQty <= 0 || fillQty > qty) {
            throw new IllegalStateException("Order (" + Long.toUnsignedString(id)
                    + ") cannot be filled for " + fillQty + ", remaining " + qty);
        }
        qty -= fillQty;
        if (level != null) level.totalQty -= fillQty;
    }

    public boolean isFilled() { return qty == 0; }

    public long filledQty() { return origQty - qty; }

    public OrderState state() {
        if (qty == 0) return OrderState.FILLED;
        if (level == null) return OrderState.PENDING;
        return qty < origQty ? OrderState.PARTIALLY_FILLED : OrderState.RESTING;
    }

    public void reset() {
        id = 0;
        side = null;
        type = null;
        price = 0;
        qty = 0;
        origQty = 0;
        prev = null;
        next = null;
        level = null;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + Long.toUnsignedString(id) +
                ", side=" + side +
                ", type=" + type +
                ", price=" + price +
                ", qty=" + qty + "/" + origQty +
                '}';
    }
}
