package com.lob.engine.book;

import java.util.function.Supplier;

/**
 * Pre-allocated free list shared by the book's pools. Every instance is created up
 * front; taking and giving back only moves the stack top.
 *
 * Not thread-safe: a pool belongs to exactly one book.
 */
abstract class FixedPool<T> {

    private final Object[] free;
    private int top;
    private int highWater;

    protected FixedPool(int capacity, Supplier<T> factory) {
        if (capacity <= 0) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " capacity must be positive: " + capacity);
        }
        free = new Object[capacity];
        for (int i = 0; i < capacity; i++) free[i] = factory.get();
        top = capacity;
    }

    /** @return a pooled instance, or null when every instance is in use */
    @SuppressWarnings("unchecked")
    protected final T take() {
        if (top == 0) return null;
        T t = (T) free[--top];
        free[top] = null;
        highWater = Math.max(highWater, free.length - top);
        return t;
    }

    protected final void giveBack(T t) {
        if (top == free.length) {
            throw new IllegalStateException(getClass().getSimpleName() + " overflow: " + t + " was not taken from this pool");
        }
        free[top++] = t;
    }

    public final int available() { return top; }

    public final int capacity() { return free.length; }

    public final int inUse() { return free.length - top; }

    /** Largest number of instances ever out at once. */
    public final int highWater() { return highWater; }
}
