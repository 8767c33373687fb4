package com.eci.notification.channel;

import com.eci.notification.model.Channel;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recipient address syntax, normalization and log masking.
 */
public final class Recipients {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern E164  = Pattern.compile("^\\+[1-9]\\d{6,14}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");

    private Recipients() {}

    /**
     * Canonical form used for deduplication: emails are trimmed and
     * lower-cased, phone numbers lose spaces, dashes, dots and parentheses.
     */
    public static String normalize(final Channel channel, final String recipient) {
        if (recipient == null) return "";
        final String trimmed = recipient.trim();
        return switch (channel) {
            case EMAIL -> trimmed.toLowerCase(Locale.ROOT);
            case SMS   -> PHONE_SEPARATORS.matcher(trimmed).replaceAll("");
        };
    }

    public static boolean isValid(final Channel channel, final String recipient) {
        if (recipient == null || recipient.isBlank()) return false;
        final String normalized = normalize(channel, recipient);
        return switch (channel) {
            case EMAIL -> EMAIL.matcher(normalized).matches();
            case SMS   -> E164.matcher(normalized).matches();
        };
    }

    /** {@code jane@example.com} → {@code ja***@example.com}, {@code +15551234567} → {@code +15551***}. */
    public static String mask(final Channel channel, final String recipient) {
        if (recipient == null) return "***";
        return switch (channel) {
            case EMAIL -> maskEmail(recipient);
            case SMS   -> recipient.length() < 6 ? "***" : recipient.substring(0, 6) + "***";
        };
    }

    private static String maskEmail(final String email) {
        final int at = email.indexOf('@');
        if (at < 0) return "***";
        final String local = email.substring(0, at);
        return (local.length() <= 2 ? local : local.substring(0, 2)) + "***" + email.substring(at);
    }
}
