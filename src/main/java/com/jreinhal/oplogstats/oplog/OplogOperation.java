package com.jreinhal.oplogstats.oplog;

import java.util.Locale;

/**
 * Operation kinds found in the {@code op} field of an oplog entry.
 */
public enum OplogOperation {
    INSERT("i"),
    UPDATE("u"),
    DELETE("d"),
    COMMAND("c"),
    NOOP("n"),
    UNKNOWN("");

    private final String code;

    OplogOperation(String code) {
        this.code = code;
    }

    public String code() {
        return this.code;
    }

    public static OplogOperation fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (OplogOperation operation : values()) {
            if (operation != UNKNOWN && operation.code.equals(normalized)) {
                return operation;
            }
        }
        return UNKNOWN;
    }
}
