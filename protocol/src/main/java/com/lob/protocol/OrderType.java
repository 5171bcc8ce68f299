package com.lob.protocol;

/**
 * Order lifetime instruction.
 *
 * GOOD_TILL_CANCEL rests until filled or cancelled.
 * FILL_AND_KILL trades whatever crosses on arrival; any remainder is discarded.
 */
public enum OrderType {
    GOOD_TILL_CANCEL((byte) 1),
    FILL_AND_KILL   ((byte) 2);

    public final byte code;
    OrderType(byte code) { this.code = code; }

    public static OrderType fromCode(byte code) {
        switch (code) {
            case 1: return GOOD_TILL_CANCEL;
            case 2: return FILL_AND_KILL;
            default: throw new IllegalArgumentException("Unknown OrderType: " + code);
        }
    }
}
