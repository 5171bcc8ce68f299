package com.lob.protocol;

/**
 * One side of a trade: which order traded, at that order's own limit price, and how much.
 */
public record TradeInfo(long orderId, long price, long quantity) {

    @Override
    public String toString() {
        return Long.toUnsignedString(orderId) + " " + quantity + "@" + price;
    }
}
