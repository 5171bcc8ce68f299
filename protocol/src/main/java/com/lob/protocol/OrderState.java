package com.lob.protocol;

/**
 * Order lifecycle.
 *
 * <pre>
 *   PENDING -> RESTING -> PARTIALLY_FILLED -> FILLED | CANCELLED
 *   PENDING -> REJECTED
 * </pre>
 *
 * FILLED, CANCELLED and REJECTED are terminal. Every transition happens
 * synchronously inside an add, cancel or modify call.
 */
public enum OrderState {
    PENDING,
    RESTING,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }
}
