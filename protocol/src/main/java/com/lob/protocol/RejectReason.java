package com.lob.protocol;

/**
 * Why an order never entered the book. Rejections are routine and are reported
 * through return values and listener callbacks, never exceptions.
 */
public enum RejectReason {
    UNKNOWN            ((byte) 0),
    DUPLICATE_ORDER_ID ((byte) 1),
    NO_LIQUIDITY       ((byte) 2),
    SYSTEM_BUSY        ((byte) 3),
    INVALID_PRICE      ((byte) 5),
    INVALID_QTY        ((byte) 6);

    public final byte code;
    RejectReason(byte code) { this.code = code; }

    private static final RejectReason[] BY_CODE = new RejectReason[256];
    static {
        for (RejectReason r : values()) BY_CODE[Byte.toUnsignedInt(r.code)] = r;
    }

    public static RejectReason fromCode(byte code) {
        RejectReason r = BY_CODE[Byte.toUnsignedInt(code)];
        return r != null ? r : UNKNOWN;
    }
}
