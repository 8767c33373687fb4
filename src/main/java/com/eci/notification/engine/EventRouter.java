package com.eci.notification.engine;

import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.error.UnknownEventTypeException;
import com.eci.notification.error.ValidationException;
import com.eci.notification.model.Channel;
import com.eci.notification.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Validates events and resolves them to (channel, recipient) pairs.
 *
 * <h2>Routing logic</h2>
 * <ol>
 *   <li>An event carrying both a channel and a recipient produces exactly
 *       that pair.</li>
 *   <li>An event carrying only a channel uses the payload's recipient key
 *       for that channel.</li>
 *   <li>Otherwise every channel routed for the event type (or the default
 *       channels) is used, with the recipient taken from the payload
 *       ({@code customer_email}, {@code customer_phone}).</li>
 * </ol>
 * Channels whose recipient is absent from the payload are skipped.
 */
public class EventRouter {

    private static final Logger LOG = LoggerFactory.getLogger(EventRouter.class);

    public record Route(Channel channel, String recipient) { }

    private final Set<String>                    knownTypes;
    private final Function<String, List<Channel>> channelsFor;
    private final Map<Channel, String>           recipientKeys;

    public EventRouter(final DispatcherConfig config) {
        this(config.getKnownEventTypes(), config::getChannelsFor, config.getRecipientKeys());
    }

    EventRouter(
            final Set<String> knownTypes,
            final Function<String, List<Channel>> channelsFor,
            final Map<Channel, String> recipientKeys) {
        this.knownTypes    = Set.copyOf(knownTypes);
        this.channelsFor   = channelsFor;
        this.recipientKeys = Map.copyOf(recipientKeys);
    }

    /**
     * @throws ValidationException        if the event id or type is blank
     * @throws UnknownEventTypeException  if the type is not routed by this service
     */
    public void validate(final Event event) {
        if (event.getEventId() == null || event.getEventId().isBlank()) {
            throw new ValidationException("event_id is required");
        }
        if (event.getEventType() == null || event.getEventType().isBlank()) {
            throw new ValidationException("event_type is required");
        }
        if (!knownTypes.contains(event.getEventType())) {
            throw new UnknownEventTypeException(event.getEventType());
        }
    }

    /** Validates {@code event} and returns its routes; may be empty. */
    public List<Route> route(final Event event) {
        validate(event);

        if (event.getChannel() != null) {
            final String recipient = hasText(event.getRecipient())
                    ? event.getRecipient()
                    : payloadRecipient(event, event.getChannel());
            if (recipient == null) {
                LOG.warn("No {} recipient on event: eventId={} type={}",
                        event.getChannel(), event.getEventId(), event.getEventType());
                return List.of();
            }
            return List.of(new Route(event.getChannel(), recipient));
        }

        final List<Route> routes = new ArrayList<>();
        for (final Channel channel : channelsFor.apply(event.getEventType())) {
            final String recipient = payloadRecipient(event, channel);
            if (recipient != null) {
                routes.add(new Route(channel, recipient));
            } else {
                LOG.debug("Skipping {} for eventId={}: no recipient in payload", channel, event.getEventId());
            }
        }
        if (routes.isEmpty()) {
            LOG.warn("Event has no deliverable recipient: eventId={} type={}",
                    event.getEventId(), event.getEventType());
        }
        return routes;
    }

    private String payloadRecipient(final Event event, final Channel channel) {
        final String key = recipientKeys.get(channel);
        return key != null ? event.payloadValue(key) : null;
    }

    private static boolean hasText(final String s) {
        return s != null && !s.isBlank();
    }
}
