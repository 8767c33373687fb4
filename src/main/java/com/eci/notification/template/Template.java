package com.eci.notification.template;

import com.eci.notification.model.Channel;

/**
 * A message template for one event type and locale.
 */
public final class Template {

    private final String eventType;
    private final String locale;
    private final String subject;
    private final String body;
    private final String shortBody;   // optional SMS text

    public Template(
            final String eventType,
            final String locale,
            final String subject,
            final String body,
            final String shortBody) {
        this.eventType = eventType;
        this.locale    = locale;
        this.subject   = subject;
        this.body      = body;
        this.shortBody = shortBody;
    }

    /** Stable identifier stored on jobs, e.g. {@code order.confirmed/en}. */
    public String getId()        { return eventType + "/" + locale; }
    public String getEventType() { return eventType; }
    public String getLocale()    { return locale; }
    public String getSubject()   { return subject; }
    public String getBody()      { return body; }
    public String getShortBody() { return shortBody; }

    /** The body text a message on {@code channel} is rendered from. */
    public String bodyFor(final Channel channel) {
        return channel == Channel.SMS && shortBody != null ? shortBody : body;
    }

    @Override
    public String toString() {
        return "Template{" + getId() + "}";
    }
}
