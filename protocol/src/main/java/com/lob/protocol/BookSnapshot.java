package com.lob.protocol;

import java.util.List;

/**
 * Read-only aggregated view of the book.
 * Bids are ordered highest price first, asks lowest price first.
 */
public record BookSnapshot(List<LevelInfo> bids, List<LevelInfo> asks) {

    public static final BookSnapshot EMPTY = new BookSnapshot(List.of(), List.of());

    public BookSnapshot {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }
}
