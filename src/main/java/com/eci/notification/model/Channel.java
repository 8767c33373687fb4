package com.eci.notification.model;

import java.util.Locale;

/**
 * Notification transport.
 */
public enum Channel {
    EMAIL,
    SMS;

    /**
     * Lenient parse used for inbound requests and config values
     * ({@code "email"}, {@code "Email"} and {@code "EMAIL"} are all accepted).
     *
     * @throws IllegalArgumentException if the value names no channel
     */
    public static Channel parse(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        try {
            return Channel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown channel: " + value);
        }
    }
}
