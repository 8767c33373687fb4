package com.eci.notification.engine;

import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.error.UnknownEventTypeException;
import com.eci.notification.error.ValidationException;
import com.eci.notification.model.Channel;
import com.eci.notification.model.Event;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class EventRouterTest {

    private final EventRouter router = new EventRouter(
            Set.of("order.confirmed", "shipment.shipped"),
            type -> type.equals("shipment.shipped") ? List.of(Channel.EMAIL, Channel.SMS) : List.of(Channel.EMAIL),
            Map.of(Channel.EMAIL, "customer_email", Channel.SMS, "customer_phone"));

    @Test
    void route_usesConfiguredChannels_withPayloadRecipients() {
        final var event = Event.builder("evt-1", "shipment.shipped")
                .put("customer_email", "jane@example.com")
                .put("customer_phone", "+15551234567")
                .build();

        assertThat(router.route(event)).containsExactly(
                new EventRouter.Route(Channel.EMAIL, "jane@example.com"),
                new EventRouter.Route(Channel.SMS, "+15551234567"));
    }

    @Test
    void bundledConfiguration_routesFlatOrderShippedType() {
        final var bundled = new EventRouter(DispatcherConfig.load());
        final var event = Event.builder("e1", "order_shipped")
                .put("customer_email", "a@x.com")
                .put("customer_phone", "+15551234567")
                .build();

        assertThat(bundled.route(event)).containsExactly(
                new EventRouter.Route(Channel.EMAIL, "a@x.com"),
                new EventRouter.Route(Channel.SMS, "+15551234567"));
    }

    @Test
    void route_skipsChannelsWithoutRecipient() {
        final var event = Event.builder("evt-1", "shipment.shipped")
                .put("customer_email", "jane@example.com")
                .put("customer_phone", " ")
                .build();

        assertThat(router.route(event)).containsExactly(new EventRouter.Route(Channel.EMAIL, "jane@example.com"));
    }

    @Test
    void route_prefersExplicitChannelAndRecipient() {
        final var event = Event.builder("evt-1", "order.confirmed")
                .put("customer_email", "jane@example.com")
                .channel(Channel.SMS)
                .recipient("+15557654321")
                .build();

        assertThat(router.route(event)).containsExactly(new EventRouter.Route(Channel.SMS, "+15557654321"));
    }

    @Test
    void route_readsPayloadRecipient_forExplicitChannel() {
        final var event = Event.builder("evt-1", "order.confirmed")
                .put("customer_phone", "+15551234567")
                .channel(Channel.SMS)
                .build();

        assertThat(router.route(event)).containsExactly(new EventRouter.Route(Channel.SMS, "+15551234567"));
        assertThat(router.route(Event.builder("evt-2", "order.confirmed").channel(Channel.SMS).build())).isEmpty();
    }

    @Test
    void validate_rejectsMissingIdOrType() {
        assertThatThrownBy(() -> router.validate(Event.builder(" ", "order.confirmed").build()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("event_id is required");
        assertThatThrownBy(() -> router.validate(Event.builder("evt-1", null).build()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("event_type is required");
    }

    @Test
    void validate_rejectsUnknownType() {
        assertThatThrownBy(() -> router.route(Event.builder("evt-1", "user.registered").build()))
                .isInstanceOf(UnknownEventTypeException.class)
                .isInstanceOf(ValidationException.class);
    }
}
