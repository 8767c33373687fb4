package com.eci.notification.error;

import com.eci.notification.model.ErrorKind;

/** Malformed event or request input. Rejected, never retried. */
public class ValidationException extends NotificationException {

    public ValidationException(final String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
