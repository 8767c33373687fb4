package com.eci.notification.error;

import com.eci.notification.model.ErrorKind;

/**
 * Base of all classified failures raised inside the dispatch service.
 * Callers branch on {@link #getKind()}, never on the concrete subclass of
 * an underlying transport exception.
 */
public class NotificationException extends RuntimeException {

    private final ErrorKind kind;

    public NotificationException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public NotificationException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
