package com.lob.engine.book;

/** Price levels for one book. */
public final class PriceLevelPool extends FixedPool<PriceLevel> {

    public PriceLevelPool(int capacity) {
        super(capacity, () -> {
            PriceLevel level = new PriceLevel();
            level.pooled = true;
            return level;
        });
    }

    /**
     * @throws IllegalStateException when exhausted; the book checks {@link #available()}
     *         before it commits to opening a level
     */
    public PriceLevel open(long price) {
        PriceLevel level = take();
        if (level == null) throw new IllegalStateException("PriceLevelPool exhausted opening level " + price);
        level.pooled = false;
        level.open(price);
        return level;
    }

    public void release(PriceLevel level) {
        if (level.pooled) {
            throw new IllegalStateException("Level " + level.price + " released twice");
        }
        if (!level.isEmpty()) {
            throw new IllegalStateException("Released level " + level.price + " still holds " + level.orderCount + " orders");
        }
        level.pooled = true;
        giveBack(level);
    }
}
