package com.lob.tools;

import com.lob.common.EngineConfig;
import com.lob.engine.sequencer.BookSequencer;
import com.lob.protocol.BookSnapshot;
import com.lob.protocol.OrderType;
import com.lob.protocol.Side;
import com.lob.protocol.Trade;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;

/**
 * In-process load generator. Pushes a seeded random stream of new orders, cancels
 * and modifies through a {@link BookSequencer} and measures round-trip latency
 * (enqueue → future completed) as seen by the caller.
 *
 * Usage:
 *   java -cp tools.jar com.lob.tools.LoadGenerator [config-path] [commands] [seed]
 */
public final class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private static final int WINDOW = 1_024;           // commands in flight before we wait
    private static final long MID_PRICE = 10_000;      // ticks
    private static final int PRICE_SPREAD = 50;        // ticks either side of mid

    private final EngineConfig cfg;
    private final long commands;
    private final SplittableRandom random;

    private final Histogram rttHist = new Histogram(10_000_000_000L, 3);
    private final List<Long> live = new ArrayList<>();
    private long nextOrderId = 1;
    private long trades;
    private long tradedQty;

    public LoadGenerator(EngineConfig cfg, long commands, long seed) {
        this.cfg = cfg;
        this.commands = commands;
        this.random = new SplittableRandom(seed);
    }

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        long commands = args.length > 1 ? Long.parseLong(args[1]) : 1_000_000L;
        long seed     = args.length > 2 ? Long.parseLong(args[2]) : new Random().nextLong();

        EngineConfig cfg = EngineConfig.load(configPath);
        log.info("Load generator: commands={} seed={} {}", commands, seed, cfg);
        Result r = new LoadGenerator(cfg, commands, seed).run();
        r.print();
    }

    public Result run() throws InterruptedException {
        BookSnapshot finalBook;
        int resting;
        long startNs = System.nanoTime();
        try (BookSequencer sequencer = new BookSequencer(cfg).start()) {
            List<CompletableFuture<?>> inFlight = new ArrayList<>(WINDOW);
            long[] sentAt = new long[WINDOW];

            for (long i = 0; i < commands; i++) {
                sentAt[inFlight.size()] = System.nanoTime();
                inFlight.add(nextCommand(sequencer));
                if (inFlight.size() == WINDOW) {
                    awaitWindow(inFlight, sentAt);
                }
            }
            awaitWindow(inFlight, sentAt);

            sequencer.verifyIntegrity().join();
            finalBook = sequencer.snapshot().join();
            resting = sequencer.size().join();
        }
        long elapsedNs = System.nanoTime() - startNs;
        return new Result(commands, trades, tradedQty, resting, finalBook, elapsedNs, rttHist);
    }

    private CompletableFuture<?> nextCommand(BookSequencer sequencer) {
        int roll = random.nextInt(100);
        if (roll < 15 && !live.isEmpty()) {
            long id = removeRandomLive();
            return sequencer.cancel(id);
        }
        if (roll < 25 && !live.isEmpty()) {
            long id = live.get(random.nextInt(live.size()));
            return sequencer.modify(id, randomSide(), randomPrice(), randomQty());
        }
        long id = nextOrderId++;
        OrderType type = roll < 35 ? OrderType.FILL_AND_KILL : OrderType.GOOD_TILL_CANCEL;
        if (type == OrderType.GOOD_TILL_CANCEL) live.add(id);
        return sequencer.submit(id, randomSide(), type, randomPrice(), randomQty());
    }

    @SuppressWarnings("unchecked")
    private void awaitWindow(List<CompletableFuture<?>> inFlight, long[] sentAt) {
        for (int i = 0; i < inFlight.size(); i++) {
            Object result = inFlight.get(i).join();
            rttHist.recordValue(Math.min(System.nanoTime() - sentAt[i], rttHist.getHighestTrackableValue()));
            if (result instanceof List) {
                for (Trade t : (List<Trade>) result) {
                    trades++;
                    tradedQty += t.quantity();
                }
            }
        }
        inFlight.clear();
        // Ids we still track may have been filled meanwhile; cancels of those are harmless no-ops.
        if (live.size() > 100_000) live.subList(0, 50_000).clear();
    }

    private long removeRandomLive() {
        int idx = random.nextInt(live.size());
        long last = live.remove(live.size() - 1);
        if (idx == live.size()) return last;
        return live.set(idx, last);
    }

    private Side randomSide() {
        return random.nextBoolean() ? Side.BUY : Side.SELL;
    }

    private long randomPrice() {
        return MID_PRICE + random.nextInt(-PRICE_SPREAD, PRICE_SPREAD + 1);
    }

    private long randomQty() {
        return 1 + random.nextInt(100);
    }

    public static final class Result {
        public final long commands;
        public final long trades;
        public final long tradedQty;
        public final int resting;
        public final BookSnapshot book;
        public final long elapsedNs;
        private final Histogram rtt;

        Result(long commands, long trades, long tradedQty, int resting, BookSnapshot book,
               long elapsedNs, Histogram rtt) {
            this.commands = commands;
            this.trades = trades;
            this.tradedQty = tradedQty;
            this.resting = resting;
            this.book = book;
            this.elapsedNs = elapsedNs;
            this.rtt = rtt;
        }

        public double rttMicros(double percentile) {
            return rtt.getValueAtPercentile(percentile) / 1_000.0;
        }

        public void print() {
            double secs = elapsedNs / 1_000_000_000.0;
            System.out.printf("%n=== Load Generator Results ===%n");
            System.out.printf("Commands:    %d (%.0f/s)%n", commands, commands / secs);
            System.out.printf("Trades:      %d (qty %d)%n", trades, tradedQty);
            System.out.printf("Resting:     %d orders, %d bid levels, %d ask levels%n",
                    resting, book.bids().size(), book.asks().size());
            System.out.printf("RTT p50:     %.1f µs%n", rttMicros(50));
            System.out.printf("RTT p99:     %.1f µs%n", rttMicros(99));
            System.out.printf("RTT p999:    %.1f µs%n", rttMicros(99.9));
            System.out.printf("RTT max:     %.1f µs%n", rtt.getMaxValue() / 1_000.0);
        }
    }
}
