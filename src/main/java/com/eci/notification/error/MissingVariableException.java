package com.eci.notification.error;

import com.eci.notification.model.ErrorKind;

import java.util.List;

/**
 * A template placeholder has no value in the event payload and no default.
 * Permanent: a retry cannot change the payload shape.
 */
public class MissingVariableException extends NotificationException {

    private final List<String> missing;

    public MissingVariableException(final String templateId, final List<String> missing) {
        super(ErrorKind.MISSING_VARIABLE,
                "Template '" + templateId + "' is missing variables " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
