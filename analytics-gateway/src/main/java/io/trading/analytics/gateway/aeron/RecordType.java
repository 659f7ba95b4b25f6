package io.trading.analytics.gateway.aeron;

/**
 * Kinds of record published over Aeron. The code is the first byte of every message.
 */
public enum RecordType {
    WINDOW((byte) 1, "windows"),
    METRICS((byte) 2, "metrics"),
    ALERT((byte) 3, "alerts");

    private final byte code;
    private final String displayName;

    RecordType(byte code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public byte code() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static RecordType fromCode(byte code) {
        for (RecordType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown record type: " + code);
    }
}
