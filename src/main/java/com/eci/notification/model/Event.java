package com.eci.notification.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An external business occurrence (order confirmed, payment refunded, ...)
 * received from the broker or the management API.
 *
 * <p>Immutable once built. The optional {@code channel}, {@code recipient}
 * and {@code locale} are routing hints: when both channel and recipient are
 * present the event produces exactly one job, otherwise the
 * {@link com.eci.notification.engine.EventRouter} derives recipients from
 * the payload.
 */
public final class Event {

    private final String              eventId;
    private final String              eventType;
    private final Map<String, String> payload;
    private final Instant             occurredAt;
    private final Channel             channel;    // optional
    private final String              recipient;  // optional
    private final String              locale;     // optional

    private Event(final Builder b) {
        this.eventId    = b.eventId;
        this.eventType  = b.eventType;
        this.payload    = Collections.unmodifiableMap(new LinkedHashMap<>(b.payload));
        this.occurredAt = b.occurredAt != null ? b.occurredAt : Instant.now();
        this.channel    = b.channel;
        this.recipient  = b.recipient;
        this.locale     = b.locale;
    }

    public static Builder builder(final String eventId, final String eventType) {
        return new Builder(eventId, eventType);
    }

    public static final class Builder {
        private final String eventId;
        private final String eventType;
        private final Map<String, String> payload = new LinkedHashMap<>();
        private Instant occurredAt;
        private Channel channel;
        private String  recipient;
        private String  locale;

        private Builder(final String eventId, final String eventType) {
            this.eventId   = eventId;
            this.eventType = eventType;
        }

        public Builder payload(final Map<String, String> values) {
            if (values != null) {
                values.forEach((k, v) -> {
                    if (k != null && v != null) payload.put(k, v);
                });
            }
            return this;
        }

        public Builder put(final String key, final String value) {
            if (key != null && value != null) payload.put(key, value);
            return this;
        }

        public Builder occurredAt(final Instant v) { this.occurredAt = v; return this; }
        public Builder channel(final Channel v)    { this.channel = v;    return this; }
        public Builder recipient(final String v)   { this.recipient = v;  return this; }
        public Builder locale(final String v)      { this.locale = v;     return this; }

        public Event build() { return new Event(this); }
    }

    public String              getEventId()    { return eventId; }
    public String              getEventType()  { return eventType; }
    public Map<String, String> getPayload()    { return payload; }
    public Instant             getOccurredAt() { return occurredAt; }
    public Channel             getChannel()    { return channel; }
    public String              getRecipient()  { return recipient; }
    public String              getLocale()     { return locale; }

    /** Payload value, or {@code null} when absent or blank. */
    public String payloadValue(final String key) {
        final String v = payload.get(key);
        return v == null || v.isBlank() ? null : v;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        final Event other = (Event) o;
        return Objects.equals(eventId, other.eventId)
            && Objects.equals(eventType, other.eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, eventType);
    }

    @Override
    public String toString() {
        return "Event{id=" + eventId
             + ", type=" + eventType
             + (channel != null ? ", channel=" + channel : "")
             + ", keys=" + payload.keySet() + "}";
    }
}
