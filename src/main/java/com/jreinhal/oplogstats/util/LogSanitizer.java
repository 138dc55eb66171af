package com.jreinhal.oplogstats.util;

import java.util.regex.Pattern;
import org.bson.Document;

public final class LogSanitizer {
    // control characters from oplog payloads would let a producer forge log lines
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_DOCUMENT_CHARS = 256;

    private LogSanitizer() {
    }

    /**
     * Strip control characters from values before they enter log output.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    /**
     * Compact, sanitized JSON rendering of a BSON document, truncated for log lines.
     */
    public static String abbreviate(Document document) {
        if (document == null) {
            return "{}";
        }
        String json = sanitize(document.toJson());
        if (json.length() <= MAX_DOCUMENT_CHARS) {
            return json;
        }
        return json.substring(0, MAX_DOCUMENT_CHARS) + "...[" + json.length() + " chars]";
    }
}
