package com.lob.engine.sequencer;

import com.lob.common.EngineConfig;
import com.lob.common.LatencyStats;
import com.lob.engine.book.LimitOrderBook;
import com.lob.engine.book.OrderEventListener;
import com.lob.protocol.BookSnapshot;
import com.lob.protocol.OrderType;
import com.lob.protocol.Side;
import com.lob.protocol.Trade;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Single-writer front end for one {@link LimitOrderBook}.
 *
 * Callers on any thread enqueue commands; one dedicated thread owns the book and
 * applies them in arrival order, completing each command's future with its result.
 *
 * Run loop: drain queue -> apply to book -> complete futures -> idle.
 * No locks on the book; the only lock gates producers against {@link #close()}.
 *
 * A full queue rejects the command. An invariant breach inside the book fails the
 * command that hit it and halts the sequencer: every later command is failed too,
 * because the book can no longer be trusted.
 */
public final class BookSequencer implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BookSequencer.class);

    private static final int DRAIN_LIMIT = 256;

    private final LimitOrderBook book;
    private final ManyToOneConcurrentArrayQueue<Command<?>> queue;
    private final IdleStrategy idleStrategy;
    private final LatencyStats latency = new LatencyStats("book-commands");
    private final long metricsIntervalNanos;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private final ReentrantReadWriteLock admission = new ReentrantReadWriteLock();
    private volatile boolean accepting = true;
    private volatile Throwable fault;

    private Thread thread;
    private long nextMetricsAt;

    public BookSequencer(EngineConfig cfg) {
        this(LimitOrderBook.create(cfg, OrderEventListener.NOOP), cfg);
    }

    public BookSequencer(LimitOrderBook book, EngineConfig cfg) {
        this.book = book;
        this.queue = new ManyToOneConcurrentArrayQueue<>(cfg.commandQueueCapacity);
        this.idleStrategy = IdleStrategies.fromName(cfg.idleStrategy);
        this.metricsIntervalNanos = TimeUnit.SECONDS.toNanos(Math.max(1, cfg.metricsIntervalSecs));
    }

    public BookSequencer start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Sequencer already started");
        }
        nextMetricsAt = System.nanoTime() + metricsIntervalNanos;
        thread = new Thread(this, "book-sequencer");
        thread.setDaemon(false);
        thread.start();
        log.info("Book sequencer started: queueCapacity={} idleStrategy={}",
                queue.capacity(), idleStrategy.getClass().getSimpleName());
        return this;
    }

    // ---- Public call surface ----

    public CompletableFuture<List<Trade>> submit(long orderId, Side side, OrderType type, long price, long qty) {
        return enqueue(b -> b.addOrder(orderId, side, type, price, qty));
    }

    public CompletableFuture<Boolean> cancel(long orderId) {
        return enqueue(b -> b.cancel(orderId));
    }

    public CompletableFuture<List<Trade>> modify(long orderId, Side side, long price, long qty) {
        return enqueue(b -> b.modifyOrder(orderId, side, price, qty));
    }

    public CompletableFuture<BookSnapshot> snapshot() {
        return enqueue(LimitOrderBook::snapshot);
    }

    public CompletableFuture<Integer> size() {
        return enqueue(LimitOrderBook::size);
    }

    /** Runs the full structural check on the engine thread. */
    public CompletableFuture<Void> verifyIntegrity() {
        return enqueue(b -> {
            b.verifyIntegrity();
            return null;
        });
    }

    public long processedCommands() { return processed.get(); }

    public boolean isHalted() { return fault != null; }

    // ---- Engine thread ----

    @Override
    public void run() {
        try {
            while (running.get() || !queue.isEmpty()) {
                int work = queue.drain(this::process, DRAIN_LIMIT);
                long now = System.nanoTime();
                if (now - nextMetricsAt >= 0) {
                    latency.logAndReset();
                    nextMetricsAt = now + metricsIntervalNanos;
                }
                idleStrategy.idle(work);
            }
            latency.logAndReset();
        } catch (Throwable t) {
            log.error("Book sequencer thread died", t);
            halt(t);
            throw t;
        }
    }

    /** Stop admission and fail everything still queued; nothing will drain it. */
    private void halt(Throwable cause) {
        admission.writeLock().lock();
        try {
            if (fault == null) fault = cause;
            accepting = false;
        } finally {
            admission.writeLock().unlock();
        }
        queue.drain(cmd -> cmd.future.completeExceptionally(
                new IllegalStateException("Sequencer halted after invariant breach", fault)));
    }

    private void process(Command<?> cmd) {
        Throwable halted = fault;
        if (halted != null) {
            cmd.future.completeExceptionally(new IllegalStateException("Sequencer halted after invariant breach", halted));
            return;
        }
        try {
            cmd.execute(book);
        } catch (RuntimeException e) {
            log.error("Book invariant breached, halting sequencer", e);
            fault = e;
            accepting = false;
            cmd.future.completeExceptionally(e);
        } catch (Error e) {
            cmd.future.completeExceptionally(e);
            throw e;
        }
        latency.record(System.nanoTime() - cmd.enqueuedNanos);
        processed.lazySet(processed.get() + 1);
    }

    // ---- Admission ----

    private <T> CompletableFuture<T> enqueue(Function<LimitOrderBook, T> action) {
        Command<T> cmd = new Command<>(action);
        admission.readLock().lock();
        try {
            if (!accepting) {
                cmd.future.completeExceptionally(fault != null
                        ? new IllegalStateException("Sequencer halted after invariant breach", fault)
                        : new RejectedExecutionException("Sequencer is closed"));
            } else if (!running.get()) {
                cmd.future.completeExceptionally(new RejectedExecutionException("Sequencer not started"));
            } else if (!queue.offer(cmd)) {
                cmd.future.completeExceptionally(new RejectedExecutionException("Command queue full"));
            }
        } finally {
            admission.readLock().unlock();
        }
        return cmd.future;
    }

    /** Stop accepting commands, let the engine thread finish everything already queued, then stop it. */
    @Override
    public void close() throws InterruptedException {
        admission.writeLock().lock();
        try {
            accepting = false;
        } finally {
            admission.writeLock().unlock();
        }
        if (running.compareAndSet(true, false)) {
            thread.join();
            log.info("Book sequencer stopped after {} commands, {} orders resting",
                    processedCommands(), book.size());
        }
    }

    private static final class Command<T> {
        final Function<LimitOrderBook, T> action;
        final CompletableFuture<T> future = new CompletableFuture<>();
        final long enqueuedNanos = System.nanoTime();

        Command(Function<LimitOrderBook, T> action) {
            this.action = action;
        }

        void execute(LimitOrderBook book) {
            future.complete(action.apply(book));
        }
    }
}
