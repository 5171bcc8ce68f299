package com.lob.engine.book;

import com.lob.protocol.RejectReason;
import com.lob.protocol.Trade;

/**
 * Lifecycle callbacks emitted synchronously by {@link LimitOrderBook} on the thread
 * that mutates it. An audit or persistence layer hooks in here; the book keeps no
 * record of its own.
 *
 * Implementations must not call back into the book.
 */
public interface OrderEventListener {

    OrderEventListener NOOP = new OrderEventListener() {};

    /** The order passed validation and was linked into its price level. */
    default void onAccepted(long orderId, long qty) {}

    /** The order never entered the book. */
    default void onRejected(long orderId, RejectReason reason) {}

    /** The order left the book unfilled, by request or because it was Fill-And-Kill. */
    default void onCancelled(long orderId, long leavesQty) {}

    default void onTrade(Trade trade) {}
}
