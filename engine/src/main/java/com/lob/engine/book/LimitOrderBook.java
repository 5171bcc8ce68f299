package com.lob.engine.book;

import com.lob.common.EngineConfig;
import com.lob.protocol.BookSnapshot;
import com.lob.protocol.LevelInfo;
import com.lob.protocol.OrderType;
import com.lob.protocol.RejectReason;
import com.lob.protocol.Side;
import com.lob.protocol.Trade;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Limit order book for a single instrument with price-time priority matching.
 *
 * Data structures:
 *   - bids: TreeMap<Long, PriceLevel> ascending (best bid = last entry with highest key)
 *   - asks: TreeMap<Long, PriceLevel> ascending (best ask = first entry)
 *   - orderMap: Long2ObjectOpenHashMap for O(1) cancel lookup
 *
 * An incoming order is first linked at the tail of its price level, then the best
 * bid level and the best ask level are matched head against head until the book no
 * longer crosses. Every trade records each order's own limit price.
 *
 * Orders and levels are pooled and reused, so once levels are established the
 * hot path (add/cancel/match) allocates only the returned trades.
 *
 * Not thread-safe. Use {@link LockedOrderBook} or
 * {@link com.lob.engine.sequencer.BookSequencer} to share a book between threads.
 */
public final class LimitOrderBook {

    private static final Logger log = LoggerFactory.getLogger(LimitOrderBook.class);

    private final OrderPool orderPool;
    private final PriceLevelPool levelPool;
    private final OrderEventListener listener;
    private final boolean allowNonPositivePrices;

    // bids: ascending TreeMap; best bid = lastKey() (highest price)
    // asks: ascending TreeMap; best ask = firstKey() (lowest price)
    private final TreeMap<Long, PriceLevel> bids = new TreeMap<>(); // price -> level
    private final TreeMap<Long, PriceLevel> asks = new TreeMap<>(); // price -> level

    // orderId -> resting Order
    private final Long2ObjectOpenHashMap<Order> orderMap = new Long2ObjectOpenHashMap<>(1024);

    public LimitOrderBook(OrderPool orderPool, PriceLevelPool levelPool) {
        this(orderPool, levelPool, OrderEventListener.NOOP, false);
    }

    public LimitOrderBook(OrderPool orderPool, PriceLevelPool levelPool,
                          OrderEventListener listener, boolean allowNonPositivePrices) {
        this.orderPool = orderPool;
        this.levelPool = levelPool;
        this.listener = listener;
        this.allowNonPositivePrices = allowNonPositivePrices;
    }

    public static LimitOrderBook create(EngineConfig cfg, OrderEventListener listener) {
        return new LimitOrderBook(new OrderPool(cfg.orderPoolSize), new PriceLevelPool(cfg.levelPoolSize),
                listener, cfg.allowNonPositivePrices);
    }

    /**
     * Add a new order and match it.
     *
     * @return the trades caused by this order, empty when nothing crossed or the
     *         order was rejected (duplicate id, invalid price or qty, Fill-And-Kill
     *         with nothing to trade against, pool exhausted)
     */
    public List<Trade> addOrder(long orderId, Side side, OrderType type, long price, long qty) {
        if (orderMap.containsKey(orderId)) {
            return reject(orderId, RejectReason.DUPLICATE_ORDER_ID);
        }
        RejectReason invalid = validate(price, qty);
        if (invalid != null) {
            return reject(orderId, invalid);
        }
        if (type == OrderType.FILL_AND_KILL && !canMatch(side, price)) {
            return reject(orderId, RejectReason.NO_LIQUIDITY);
        }
        TreeMap<Long, PriceLevel> book = ladder(side);
        if (orderPool.available() == 0 || (levelPool.available() == 0 && !book.containsKey(price))) {
            log.warn("Book pools exhausted: orders {}/{} levels {}/{} in use",
                    orderPool.inUse(), orderPool.capacity(), levelPool.inUse(), levelPool.capacity());
            return reject(orderId, RejectReason.SYSTEM_BUSY);
        }

        Order order = orderPool.acquire(orderId, side, type, price, qty);
        restOrder(book, order);
        orderMap.put(orderId, order);
        listener.onAccepted(orderId, qty);

        List<Trade> trades = matchOrders();

        // Only the order just added can be a Fill-And-Kill left in the book: every
        // earlier one was either filled or killed by the call that added it.
        if (type == OrderType.FILL_AND_KILL && orderMap.containsKey(orderId)) {
            cancel(orderId);
        }
        return trades;
    }

    /** Cancel by order id. Returns true if found and cancelled; unknown ids are a no-op. */
    public boolean cancel(long orderId) {
        Order o = orderMap.remove(orderId);
        if (o == null) return false;

        PriceLevel level = o.level;
        if (level == null) {
            throw new IllegalStateException("Indexed order is not linked into any price level: " + o);
        }
        level.unlink(o);
        if (level.isEmpty()) {
            removeLevel(ladder(o.side), level);
        }
        listener.onCancelled(orderId, o.qty);
        orderPool.release(o);
        return true;
    }

    /**
     * Replace a resting order: withdraw it and resubmit with the new side, price and
     * quantity, keeping its order type. The replacement queues behind every order
     * already at its new price and may trade immediately.
     *
     * Unknown ids return no trades. An invalid price or quantity, or a new price
     * that would need a level the pool cannot supply, is rejected and the existing
     * order stays where it was.
     */
    public List<Trade> modifyOrder(long orderId, Side side, long price, long qty) {
        Order existing = orderMap.get(orderId);
        if (existing == null) return Collections.emptyList();

        RejectReason invalid = validate(price, qty);
        if (invalid != null) {
            return reject(orderId, invalid);
        }
        if (!canPlace(existing, side, price)) {
            log.warn("Level pool exhausted, modify of {} to {} kept the resting order",
                    Long.toUnsignedString(orderId), price);
            return reject(orderId, RejectReason.SYSTEM_BUSY);
        }
        OrderType type = existing.type;
        cancel(orderId);
        return addOrder(orderId, side, type, price, qty);
    }

    /** Aggregated depth per price level, best price first on both sides. */
    public BookSnapshot snapshot() {
        List<LevelInfo> bidInfos = new ArrayList<>(bids.size());
        List<LevelInfo> askInfos = new ArrayList<>(asks.size());
        for (PriceLevel level : bids.descendingMap().values()) {
            bidInfos.add(new LevelInfo(level.price, level.totalQty));
        }
        for (PriceLevel level : asks.values()) {
            askInfos.add(new LevelInfo(level.price, level.totalQty));
        }
        return new BookSnapshot(bidInfos, askInfos);
    }

    /** Number of resting orders. */
    public int size() { return orderMap.size(); }

    public boolean contains(long orderId) { return orderMap.containsKey(orderId); }

    /** Remaining quantity of a resting order, or -1 if it is not in the book. */
    public long remainingQty(long orderId) {
        Order o = orderMap.get(orderId);
        return o == null ? -1 : o.qty;
    }

    public long bestBid() { return bids.isEmpty() ? Long.MIN_VALUE : bids.lastKey(); }
    public long bestAsk() { return asks.isEmpty() ? Long.MAX_VALUE : asks.firstKey(); }

    public int bidLevels() { return bids.size(); }
    public int askLevels() { return asks.size(); }

    // ---- Matching ----

    private boolean canMatch(Side side, long price) {
        if (side == Side.BUY) {
            return !asks.isEmpty() && price >= asks.firstKey();
        }
        return !bids.isEmpty() && price <= bids.lastKey();
    }

    private List<Trade> matchOrders() {
        List<Trade> trades = null;

        while (!bids.isEmpty() && !asks.isEmpty()) {
            PriceLevel bidLevel = bids.lastEntry().getValue();
            PriceLevel askLevel = asks.firstEntry().getValue();
            if (bidLevel.price < askLevel.price) break; // no cross

            while (!bidLevel.isEmpty() && !askLevel.isEmpty()) {
                Order bid = bidLevel.head;
                Order ask = askLevel.head;
                long fillQty = Math.min(bid.qty, ask.qty);
                bid.fill(fillQty);
                ask.fill(fillQty);

                Trade trade = Trade.of(bid.id, bid.price, ask.id, ask.price, fillQty);
                if (trades == null) trades = new ArrayList<>(4);
                trades.add(trade);
                listener.onTrade(trade);

                if (bid.isFilled()) retire(bid);
                if (ask.isFilled()) retire(ask);
            }

            // Levels are only unregistered once the inner loop has let go of them
            if (bidLevel.isEmpty()) removeLevel(bids, bidLevel);
            if (askLevel.isEmpty()) removeLevel(asks, askLevel);
        }
        return trades == null ? Collections.emptyList() : trades;
    }

    /** Unlink and recycle a fully filled order. */
    private void retire(Order filled) {
        filled.level.unlink(filled);
        if (orderMap.remove(filled.id) != filled) {
            throw new IllegalStateException("Filled order missing from order index: " + filled);
        }
        orderPool.release(filled);
    }

    // ---- Book maintenance ----

    private void restOrder(TreeMap<Long, PriceLevel> book, Order o) {
        PriceLevel level = book.get(o.price);
        if (level == null) {
            level = levelPool.open(o.price);
            book.put(o.price, level);
        }
        level.append(o);
    }

    /** Whether the replacement can find a level once {@code existing} is cancelled. */
    private boolean canPlace(Order existing, Side side, long price) {
        return ladder(side).containsKey(price)
                || existing.level.orderCount == 1
                || levelPool.available() > 0;
    }

    private void removeLevel(TreeMap<Long, PriceLevel> book, PriceLevel level) {
        if (!book.remove(level.price, level)) {
            throw new IllegalStateException("Price level " + level.price + " is not registered in its ladder");
        }
        levelPool.release(level);
    }

    private TreeMap<Long, PriceLevel> ladder(Side side) {
        return side == Side.BUY ? bids : asks;
    }

    private RejectReason validate(long price, long qty) {
        if (qty <= 0) return RejectReason.INVALID_QTY;
        if (price <= 0 && !allowNonPositivePrices) return RejectReason.INVALID_PRICE;
        return null;
    }

    private List<Trade> reject(long orderId, RejectReason reason) {
        if (log.isDebugEnabled()) {
            log.debug("Rejected order {}: {}", Long.toUnsignedString(orderId), reason);
        }
        listener.onRejected(orderId, reason);
        return Collections.emptyList();
    }

    // ---- Integrity ----

    /**
     * Walk every structure and check the book invariants: no empty level is
     * registered, level totals match their orders, every linked order is indexed
     * (and nothing else is), quantities are within bounds, no Fill-And-Kill order
     * rests, and the book is not crossed.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void verifyIntegrity() {
        int linked = verifyLadder(bids, Side.BUY) + verifyLadder(asks, Side.SELL);
        if (linked != orderMap.size()) {
            throw new IllegalStateException("Order index holds " + orderMap.size()
                    + " orders but ladders link " + linked);
        }
        if (!bids.isEmpty() && !asks.isEmpty() && bids.lastKey() >= asks.firstKey()) {
            throw new IllegalStateException("Book is crossed: bid " + bids.lastKey() + " >= ask " + asks.firstKey());
        }
    }

    private int verifyLadder(TreeMap<Long, PriceLevel> book, Side side) {
        int linked = 0;
        for (Map.Entry<Long, PriceLevel> e : book.entrySet()) {
            PriceLevel level = e.getValue();
            if (level.isEmpty()) {
                throw new IllegalStateException(side + " level " + e.getKey() + " is registered but empty");
            }
            if (level.price != e.getKey()) {
                throw new IllegalStateException(side + " level keyed " + e.getKey() + " has price " + level.price);
            }
            long total = 0;
            int count = 0;
            for (Order o = level.head; o != null; o = o.next) {
                if (o.level != level || o.side != side || o.price != level.price) {
                    throw new IllegalStateException("Order linked into wrong level: " + o);
                }
                if (o.qty <= 0 || o.qty > o.origQty) {
                    throw new IllegalStateException("Resting order has invalid quantity: " + o);
                }
                if (o.type == OrderType.FILL_AND_KILL) {
                    throw new IllegalStateException("Fill-And-Kill order is resting: " + o);
                }
                if (orderMap.get(o.id) != o) {
                    throw new IllegalStateException("Resting order missing from order index: " + o);
                }
                total += o.qty;
                count++;
            }
            if (total != level.totalQty || count != level.orderCount) {
                throw new IllegalStateException(side + " level " + level.price + " totals " + level.totalQty
                        + "/" + level.orderCount + " but orders sum to " + total + "/" + count);
            }
            linked += count;
        }
        return linked;
    }
}
