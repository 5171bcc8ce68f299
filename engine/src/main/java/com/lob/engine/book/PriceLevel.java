package com.lob.engine.book;

/**
 * FIFO queue of the resting orders at one price, oldest at {@link #head}.
 *
 * The queue is threaded through {@link Order#prev}/{@link Order#next} so linking
 * and unlinking never allocate. {@link #totalQty} is kept equal to the sum of the
 * linked orders' remaining quantities; fills adjust it through {@link Order#fill(long)}.
 */
public final class PriceLevel {

    public long price;
    public long totalQty;
    public int  orderCount;
    public Order head;
    public Order tail;

    // True while sitting in a PriceLevelPool free list
    boolean pooled;

    void open(long price) {
        this.price = price;
        totalQty = 0;
        orderCount = 0;
        head = null;
        tail = null;
    }

    /** Queue an order behind everything already at this price. */
    public void append(Order o) {
        if (o.level != null) {
            throw new IllegalStateException(o + " is already linked at " + o.level.price);
        }
        if (o.price != price) {
            throw new IllegalStateException(o + " does not belong at price " + price);
        }
        o.level = this;
        o.prev = tail;
        o.next = null;
        if (tail == null) {
            head = o;
        } else {
            tail.next = o;
        }
        tail = o;
        totalQty += o.qty;
        orderCount++;
    }

    /** Take an order out of the queue from any position. */
    public void unlink(Order o) {
        if (o.level != this) {
            throw new IllegalStateException(o + " is not linked into level " + price);
        }
        Order before = o.prev;
        Order after = o.next;
        if (before == null) head = after; else before.next = after;
        if (after == null) tail = before; else after.prev = before;
        totalQty -= o.qty;
        orderCount--;
        o.prev = null;
        o.next = null;
        o.level = null;
    }

    public boolean isEmpty() { return orderCount == 0; }

    @Override
    public String toString() {
        return "PriceLevel{price=" + price + ", orders=" + orderCount + ", qty=" + totalQty + '}';
    }
}
