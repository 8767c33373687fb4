package com.eci.notification.channel;

import com.eci.notification.model.Channel;
import com.eci.notification.model.ProviderResult;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Maps provider HTTP outcomes to {@link ProviderResult} statuses.
 *
 * <ul>
 *   <li>2xx: success</li>
 *   <li>408, 425, 429 and 5xx: retryable</li>
 *   <li>any other status: permanent</li>
 *   <li>I/O errors and timeouts: retryable</li>
 * </ul>
 */
public final class ProviderResponses {

    private static final int MAX_ERROR_BODY = 500;

    private ProviderResponses() {}

    public static boolean isRetryableStatus(final int code) {
        return code == 408 || code == 425 || code == 429 || code >= 500;
    }

    /** Failure result for a non-2xx response. */
    public static ProviderResult failure(
            final String provider,
            final Channel channel,
            final int code,
            final String body) {
        final String error = "HTTP " + code + ": " + truncate(body);
        final ProviderResult.Builder b = ProviderResult.builder(provider, channel);
        return (isRetryableStatus(code) ? b.retryable(error, code) : b.permanent(error, code)).build();
    }

    public static ProviderResult ioFailure(final String provider, final Channel channel, final IOException e) {
        final String error = e instanceof InterruptedIOException
                ? "Timed out: " + e.getMessage()
                : e.getClass().getSimpleName() + ": " + e.getMessage();
        return ProviderResult.builder(provider, channel).retryable(error, 0).build();
    }

    public static ProviderResult invalidRecipient(final String provider, final Channel channel) {
        return ProviderResult.builder(provider, channel)
                .permanent("Invalid " + channel.name().toLowerCase() + " recipient", 0)
                .build();
    }

    private static String truncate(final String body) {
        if (body == null || body.isEmpty()) return "(empty)";
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
