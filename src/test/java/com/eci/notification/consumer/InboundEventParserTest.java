package com.eci.notification.consumer;

import com.eci.notification.error.ValidationException;
import com.eci.notification.model.Channel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class InboundEventParserTest {

    private final InboundEventParser parser = new InboundEventParser(new ObjectMapper());

    @Test
    void parse_readsAllFields() {
        final var event = parser.parse(String.join("\n",
                "{",
                "  \"event_id\": \"evt-1\",",
                "  \"event_type\": \"order.confirmed\",",
                "  \"occurred_at\": \"2024-05-01T10:15:30Z\",",
                "  \"channel\": \"email\",",
                "  \"recipient\": \" jane@example.com \",",
                "  \"locale\": \"fr-CA\",",
                "  \"payload\": { \"order_id\": \"o-1\", \"order_total\": 99.9, \"item_count\": 2, \"gift\": true }",
                "}"), "fallback");

        assertThat(event.getEventId()).isEqualTo("evt-1");
        assertThat(event.getEventType()).isEqualTo("order.confirmed");
        assertThat(event.getOccurredAt()).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
        assertThat(event.getChannel()).isEqualTo(Channel.EMAIL);
        assertThat(event.getRecipient()).isEqualTo("jane@example.com");
        assertThat(event.getLocale()).isEqualTo("fr-CA");
        assertThat(event.getPayload())
                .containsEntry("order_id", "o-1")
                .containsEntry("order_total", "99.9")
                .containsEntry("item_count", "2")
                .containsEntry("gift", "true");
    }

    @Test
    void parse_usesFallbackId_andDataAlias() {
        final var event = parser.parse(
                "{\"event_type\":\"payment.failed\",\"data\":{\"amount\":\"10.00\",\"note\":null,\"items\":[1,2]}}",
                "orders:3:42");

        assertThat(event.getEventId()).isEqualTo("orders:3:42");
        assertThat(event.getPayload())
                .containsEntry("amount", "10.00")
                .containsEntry("items", "[1,2]")
                .doesNotContainKey("note");
        assertThat(event.getChannel()).isNull();
    }

    @Test
    void parse_leavesTypeChecksToEngine() {
        final var event = parser.parse("{\"event_id\":\"evt-1\"}", "fallback");

        assertThat(event.getEventType()).isNull();
        assertThat(event.getPayload()).isEmpty();
    }

    @Test
    void parse_rejectsMalformedJson() {
        assertThatThrownBy(() -> parser.parse("{not json", "f"))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Malformed JSON");
        assertThatThrownBy(() -> parser.parse("  ", "f"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void parse_rejectsWrongShapes() {
        assertThatThrownBy(() -> parser.parse("[1,2]", "f"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Event must be a JSON object");
        assertThatThrownBy(() -> parser.parse("{\"event_type\":\"x\",\"payload\":\"text\"}", "f"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("payload must be a JSON object");
        assertThatThrownBy(() -> parser.parse("{\"event_type\":\"x\",\"occurred_at\":\"yesterday\"}", "f"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> parser.parse("{\"event_type\":\"x\",\"channel\":\"PUSH\"}", "f"))
                .isInstanceOf(ValidationException.class);
    }
}
