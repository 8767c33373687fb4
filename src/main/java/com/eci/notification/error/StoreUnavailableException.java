package com.eci.notification.error;

import com.eci.notification.model.ErrorKind;

/**
 * Infrastructure failure of the state or idempotency store. Surfaced to
 * the health check; inbound consumption pauses instead of dropping events.
 */
public class StoreUnavailableException extends NotificationException {

    public StoreUnavailableException(final String message) {
        super(ErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(final String message, final Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
