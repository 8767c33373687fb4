package com.eci.notification.error;

import com.eci.notification.model.ErrorKind;

public class TemplateNotFoundException extends NotificationException {

    public TemplateNotFoundException(final String eventType, final String locale) {
        super(ErrorKind.TEMPLATE_NOT_FOUND,
                "No template for event type '" + eventType + "' (locale " + locale + ")");
    }
}
