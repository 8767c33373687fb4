package com.eci.notification.engine;

import com.eci.notification.channel.Recipients;
import com.eci.notification.model.Channel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Dedup key of a logical notification:
 * {@code hex(sha256(eventId | CHANNEL | normalizedRecipient))}.
 */
public final class DedupKeys {

    private DedupKeys() {}

    public static String of(final String eventId, final Channel channel, final String recipient) {
        final String material = eventId + "|" + channel.name() + "|" + Recipients.normalize(channel, recipient);
        try {
            final MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
