package com.eci.notification.channel;

import com.eci.notification.model.Channel;
import com.eci.notification.model.ProviderResult;
import com.eci.notification.model.RenderedNotification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Email provider backed by the SendGrid v3 Mail Send API.
 *
 * <p>API reference: <a href="https://docs.sendgrid.com/api-reference/mail-send/mail-send">
 * SendGrid Mail Send v3</a>
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code SENDGRID_API_KEY}: a SendGrid API key with "Mail Send" permission</li>
 * </ul>
 */
public class SendGridEmailProvider implements ChannelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(SendGridEmailProvider.class);
    static final String DEFAULT_ENDPOINT = "https://api.sendgrid.com/v3/mail/send";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String apiKey;
    private final String fromAddress;
    private final String fromName;
    private final String replyTo;
    private final String endpoint;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public SendGridEmailProvider(
            final String apiKey,
            final String fromAddress,
            final String fromName,
            final String replyTo,
            final Duration timeout) {
        this(apiKey, fromAddress, fromName, replyTo, DEFAULT_ENDPOINT, timeout);
    }

    public SendGridEmailProvider(
            final String apiKey,
            final String fromAddress,
            final String fromName,
            final String replyTo,
            final String endpoint,
            final Duration timeout) {
        this.apiKey      = apiKey;
        this.fromAddress = fromAddress;
        this.fromName    = fromName;
        this.replyTo     = replyTo;
        this.endpoint    = endpoint;
        this.http = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .callTimeout(timeout)
                .build();
    }

    @Override public String  providerName() { return "sendgrid"; }
    @Override public Channel channel()      { return Channel.EMAIL; }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank()
            && fromAddress != null && !fromAddress.isBlank();
    }

    @Override
    public ProviderResult send(final RenderedNotification notification) {
        if (!Recipients.isValid(Channel.EMAIL, notification.getRecipient())) {
            LOG.warn("SendGrid skipped invalid recipient: jobId={} to={}",
                    notification.getJobId(), Recipients.mask(Channel.EMAIL, notification.getRecipient()));
            return ProviderResponses.invalidRecipient(providerName(), channel());
        }

        final String payload;
        try {
            payload = buildPayload(notification);
        } catch (JsonProcessingException e) {
            return ProviderResult.builder(providerName(), channel())
                    .permanent("Failed to serialize SendGrid payload: " + e.getMessage(), 0)
                    .build();
        }

        final Request request = new Request.Builder()
                .url(endpoint)
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(payload, JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            final int code = response.code();
            if (response.isSuccessful()) {
                // SendGrid returns 202 Accepted with the id in X-Message-Id
                final String msgId = response.header("X-Message-Id", "unknown");
                LOG.info("SendGrid email sent: jobId={} to={} msgId={}",
                        notification.getJobId(),
                        Recipients.mask(Channel.EMAIL, notification.getRecipient()), msgId);
                return ProviderResult.builder(providerName(), channel()).success(msgId, code).build();
            }
            final String body = response.body() != null ? response.body().string() : "";
            LOG.warn("SendGrid rejected email: jobId={} http={} body={}", notification.getJobId(), code, body);
            return ProviderResponses.failure(providerName(), channel(), code, body);
        } catch (IOException e) {
            LOG.error("SendGrid IO error: jobId={} error={}", notification.getJobId(), e.getMessage());
            return ProviderResponses.ioFailure(providerName(), channel(), e);
        }
    }

    private String buildPayload(final RenderedNotification notification) throws JsonProcessingException {
        final ObjectNode root = mapper.createObjectNode();

        final ArrayNode personalizations = root.putArray("personalizations");
        final ObjectNode personalization = personalizations.addObject();
        personalization.putArray("to").addObject().put("email", notification.getRecipient().trim());

        final ObjectNode from = root.putObject("from");
        from.put("email", fromAddress);
        if (fromName != null && !fromName.isBlank()) {
            from.put("name", fromName);
        }

        if (replyTo != null && !replyTo.isBlank()) {
            root.putObject("reply_to").put("email", replyTo);
        }

        root.put("subject", notification.getSubject() != null ? notification.getSubject() : "");

        final ArrayNode content = root.putArray("content");
        final ObjectNode text = content.addObject();
        text.put("type",  "text/plain");
        text.put("value", notification.getBody());

        // echoed back in SendGrid event webhooks
        final ObjectNode customArgs = root.putObject("custom_args");
        customArgs.put("job_id",     notification.getJobId());
        customArgs.put("event_type", notification.getEventType());

        return mapper.writeValueAsString(root);
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
