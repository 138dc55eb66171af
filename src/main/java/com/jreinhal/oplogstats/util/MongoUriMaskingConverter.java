package com.jreinhal.oplogstats.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.regex.Pattern;

/**
 * Logback converter that hides the password of {@code mongodb://} and {@code mongodb+srv://}
 * connection strings, which the driver and Spring Boot both log at startup.
 */
public class MongoUriMaskingConverter extends ClassicConverter {
    private static final Pattern CREDENTIALS = Pattern.compile("(mongodb(?:\\+srv)?://[^:/@\\s]+):[^@/\\s]+@");

    @Override
    public String convert(ILoggingEvent event) {
        return mask(event.getFormattedMessage());
    }

    public static String mask(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        return CREDENTIALS.matcher(message).replaceAll("$1:****@");
    }
}
