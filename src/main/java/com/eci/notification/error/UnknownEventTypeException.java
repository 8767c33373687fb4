package com.eci.notification.error;

/** The event names a type this service has no routing for. */
public class UnknownEventTypeException extends ValidationException {

    private final String eventType;

    public UnknownEventTypeException(final String eventType) {
        super("Unknown event type: " + eventType);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
