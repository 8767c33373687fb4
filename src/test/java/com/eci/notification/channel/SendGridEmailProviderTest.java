package com.eci.notification.channel;

import com.eci.notification.model.Channel;
import com.eci.notification.model.ErrorKind;
import com.eci.notification.model.ProviderResult;
import com.eci.notification.model.RenderedNotification;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class SendGridEmailProviderTest {

    private MockWebServer server;
    private SendGridEmailProvider provider;

    @BeforeEach
    void setup() throws Exception {
        server = new MockWebServer();
        server.start();
        provider = providerWithTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void teardown() throws Exception {
        provider.close();
        server.shutdown();
    }

    private SendGridEmailProvider providerWithTimeout(final Duration timeout) {
        return new SendGridEmailProvider("test-api-key", "noreply@eci.com", "ECI Shop", "support@eci.com",
                server.url("/v3/mail/send").toString(), timeout);
    }

    @Test
    void send_returnsSuccess_on202Response() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(202)
                .addHeader("X-Message-Id", "sg-12345"));

        final ProviderResult result = provider.send(notification("Jane@Example.com"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProviderMessageId()).isEqualTo("sg-12345");
        assertThat(result.getResponseCode()).isEqualTo(202);

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-api-key");

        final var json = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(json.at("/personalizations/0/to/0/email").asText()).isEqualTo("Jane@Example.com");
        assertThat(json.at("/from/email").asText()).isEqualTo("noreply@eci.com");
        assertThat(json.at("/from/name").asText()).isEqualTo("ECI Shop");
        assertThat(json.at("/reply_to/email").asText()).isEqualTo("support@eci.com");
        assertThat(json.at("/subject").asText()).isEqualTo("Order Confirmation - Order #o-1");
        assertThat(json.at("/content/0/type").asText()).isEqualTo("text/plain");
        assertThat(json.at("/custom_args/job_id").asText()).isEqualTo("job-1");
        assertThat(json.at("/custom_args/event_type").asText()).isEqualTo("order.confirmed");
    }

    @Test
    void send_usesUnknownMessageId_whenHeaderMissing() {
        server.enqueue(new MockResponse().setResponseCode(202));

        assertThat(provider.send(notification("jane@example.com")).getProviderMessageId()).isEqualTo("unknown");
    }

    @Test
    void send_returnsRetryable_on429And503() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(503));

        final var throttled   = provider.send(notification("jane@example.com"));
        final var unavailable = provider.send(notification("jane@example.com"));

        assertThat(throttled.getStatus()).isEqualTo(ProviderResult.Status.RETRYABLE_FAILURE);
        assertThat(throttled.getErrorMessage()).isEqualTo("HTTP 429: slow down");
        assertThat(unavailable.getStatus()).isEqualTo(ProviderResult.Status.RETRYABLE_FAILURE);
        assertThat(unavailable.getResponseCode()).isEqualTo(503);
    }

    @Test
    void send_returnsPermanent_on400Response() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"errors\":[{\"message\":\"bad\"}]}"));

        final var result = provider.send(notification("jane@example.com"));

        assertThat(result.getStatus()).isEqualTo(ProviderResult.Status.PERMANENT_FAILURE);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.PERMANENT_FAILURE);
        assertThat(result.getErrorMessage()).startsWith("HTTP 400: ").contains("bad");
    }

    @Test
    void send_rejectsInvalidRecipient_withoutCallingApi() {
        final var result = provider.send(notification("not-an-email"));

        assertThat(result.getStatus()).isEqualTo(ProviderResult.Status.PERMANENT_FAILURE);
        assertThat(result.getErrorMessage()).isEqualTo("Invalid email recipient");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void send_returnsRetryable_whenConnectionDrops() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        final var result = provider.send(notification("jane@example.com"));

        assertThat(result.getStatus()).isEqualTo(ProviderResult.Status.RETRYABLE_FAILURE);
        assertThat(result.getResponseCode()).isZero();
    }

    @Test
    void send_returnsRetryable_onCallTimeout() {
        provider.close();
        provider = providerWithTimeout(Duration.ofMillis(200));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        final var result = provider.send(notification("jane@example.com"));

        assertThat(result.getStatus()).isEqualTo(ProviderResult.Status.RETRYABLE_FAILURE);
        assertThat(result.getErrorMessage()).startsWith("Timed out");
    }

    @Test
    void isConfigured_requiresApiKeyAndSender() {
        assertThat(provider.isConfigured()).isTrue();
        assertThat(new SendGridEmailProvider("", "from@eci.com", null, null, Duration.ofSeconds(1)).isConfigured())
                .isFalse();
        assertThat(new SendGridEmailProvider("key", null, null, null, Duration.ofSeconds(1)).isConfigured())
                .isFalse();
    }

    @Test
    void providerName_andChannel() {
        assertThat(provider.providerName()).isEqualTo("sendgrid");
        assertThat(provider.channel()).isEqualTo(Channel.EMAIL);
    }

    private static RenderedNotification notification(final String to) {
        return new RenderedNotification("job-1", "order.confirmed", Channel.EMAIL, to,
                "Order Confirmation - Order #o-1", "Dear Jane, thank you for your order!");
    }
}
