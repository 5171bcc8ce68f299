package com.lob.protocol;

import java.util.Objects;

/**
 * Immutable record of a single match between the best bid and the best ask.
 *
 * Both sides always carry the same quantity. Prices may differ: each resting
 * order trades at its own limit price.
 */
public record Trade(TradeInfo bid, TradeInfo ask) {

    public Trade {
        Objects.requireNonNull(bid, "bid");
        Objects.requireNonNull(ask, "ask");
        if (bid.quantity() != ask.quantity()) {
            throw new IllegalStateException("Trade legs disagree on quantity: bid=" + bid + " ask=" + ask);
        }
    }

    public static Trade of(long bidOrderId, long bidPrice, long askOrderId, long askPrice, long quantity) {
        return new Trade(new TradeInfo(bidOrderId, bidPrice, quantity), new TradeInfo(askOrderId, askPrice, quantity));
    }

    public long quantity() { return bid.quantity(); }

    @Override
    public String toString() {
        return "Trade{bid=" + bid + ", ask=" + ask + '}';
    }
}
