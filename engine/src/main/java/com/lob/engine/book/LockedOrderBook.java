package com.lob.engine.book;

import com.lob.protocol.BookSnapshot;
import com.lob.protocol.OrderType;
import com.lob.protocol.Side;
import com.lob.protocol.Trade;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe view of a {@link LimitOrderBook} guarded by one book-wide lock.
 *
 * Matching can touch any number of levels, so there is no per-level locking:
 * every mutation takes the write lock, queries share the read lock.
 * Listener callbacks run while the write lock is held.
 */
public final class LockedOrderBook {

    private final LimitOrderBook book;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LockedOrderBook(LimitOrderBook book) {
        this.book = book;
    }

    public List<Trade> addOrder(long orderId, Side side, OrderType type, long price, long qty) {
        lock.writeLock().lock();
        try {
            return book.addOrder(orderId, side, type, price, qty);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean cancel(long orderId) {
        lock.writeLock().lock();
        try {
            return book.cancel(orderId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Trade> modifyOrder(long orderId, Side side, long price, long qty) {
        lock.writeLock().lock();
        try {
            return book.modifyOrder(orderId, side, price, qty);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public BookSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return book.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return book.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long bestBid() {
        lock.readLock().lock();
        try {
            return book.bestBid();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long bestAsk() {
        lock.readLock().lock();
        try {
            return book.bestAsk();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void verifyIntegrity() {
        lock.readLock().lock();
        try {
            book.verifyIntegrity();
        } finally {
            lock.readLock().unlock();
        }
    }
}
