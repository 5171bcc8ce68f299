package com.lob.engine.book;

import com.lob.protocol.OrderType;
import com.lob.protocol.Side;
import com.lob.protocol.Trade;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LockedOrderBookTest {

    private static final int THREADS = 4;
    private static final int ORDERS_PER_THREAD = 5_000;

    @Test
    void concurrentBuyersAndSellersConserveQuantity() throws Exception {
        LockedOrderBook book = new LockedOrderBook(
                new LimitOrderBook(new OrderPool(THREADS * ORDERS_PER_THREAD), new PriceLevelPool(64)));
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch go = new CountDownLatch(1);

        try {
            List<Future<Long>> traded = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                final int thread = t;
                traded.add(pool.submit(() -> {
                    go.await();
                    long qty = 0;
                    Side side = thread % 2 == 0 ? Side.BUY : Side.SELL;
                    for (int i = 0; i < ORDERS_PER_THREAD; i++) {
                        long id = (long) thread * ORDERS_PER_THREAD + i + 1;
                        for (Trade trade : book.addOrder(id, side, OrderType.GOOD_TILL_CANCEL, 100 + i % 3, 1)) {
                            qty += trade.quantity();
                        }
                        book.snapshot();
                    }
                    return qty;
                }));
            }
            go.countDown();

            long tradedQty = 0;
            for (Future<Long> f : traded) tradedQty += f.get(30, TimeUnit.SECONDS);

            // Every order has qty 1: each unit traded removed one buy and one sell
            long submitted = (long) THREADS * ORDERS_PER_THREAD;
            assertEquals(submitted - 2 * tradedQty, book.size());
            assertTrue(book.bestBid() < book.bestAsk(), "Book must never be left crossed");
            book.verifyIntegrity();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void delegatesEveryOperation() {
        LockedOrderBook book = new LockedOrderBook(new LimitOrderBook(new OrderPool(8), new PriceLevelPool(8)));

        book.addOrder(1, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 5);
        book.addOrder(2, Side.SELL, OrderType.GOOD_TILL_CANCEL, 101, 5);
        assertEquals(100, book.bestBid());
        assertEquals(101, book.bestAsk());

        List<Trade> trades = book.modifyOrder(2, Side.SELL, 100, 5);
        assertEquals(List.of(Trade.of(1, 100, 2, 100, 5)), trades);
        assertEquals(0, book.size());

        book.addOrder(3, Side.BUY, OrderType.GOOD_TILL_CANCEL, 100, 5);
        assertTrue(book.cancel(3));
        assertTrue(book.snapshot().isEmpty());
    }
}
