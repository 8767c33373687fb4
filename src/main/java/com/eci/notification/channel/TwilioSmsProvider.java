package com.eci.notification.channel;

import com.eci.notification.model.Channel;
import com.eci.notification.model.ProviderResult;
import com.eci.notification.model.RenderedNotification;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * SMS provider backed by Twilio Programmable SMS.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code TWILIO_ACCOUNT_SID}</li>
 *   <li>{@code TWILIO_AUTH_TOKEN}</li>
 *   <li>{@code TWILIO_FROM_NUMBER}: a Twilio number in E.164 format or a
 *       registered alphanumeric sender ID</li>
 * </ul>
 *
 * <p>API reference:
 * <a href="https://www.twilio.com/docs/sms/api/message-resource#create-a-message-resource">
 * Twilio Messages Resource</a>
 */
public class TwilioSmsProvider implements ChannelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(TwilioSmsProvider.class);
    static final String DEFAULT_BASE_URL = "https://api.twilio.com";
    static final int MAX_SMS_LENGTH = 1600;

    private final String accountSid;
    private final String authToken;
    private final String fromNumber;
    private final String baseUrl;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public TwilioSmsProvider(
            final String accountSid,
            final String authToken,
            final String fromNumber,
            final Duration timeout) {
        this(accountSid, authToken, fromNumber, DEFAULT_BASE_URL, timeout);
    }

    public TwilioSmsProvider(
            final String accountSid,
            final String authToken,
            final String fromNumber,
            final String baseUrl,
            final Duration timeout) {
        this.accountSid = accountSid;
        this.authToken  = authToken;
        this.fromNumber = fromNumber;
        this.baseUrl    = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.http = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .callTimeout(timeout)
                .build();
    }

    @Override public String  providerName() { return "twilio"; }
    @Override public Channel channel()      { return Channel.SMS; }

    @Override
    public boolean isConfigured() {
        return accountSid != null && !accountSid.isBlank()
            && authToken  != null && !authToken.isBlank()
            && fromNumber != null && !fromNumber.isBlank();
    }

    @Override
    public ProviderResult send(final RenderedNotification notification) {
        if (!Recipients.isValid(Channel.SMS, notification.getRecipient())) {
            LOG.warn("Twilio skipped invalid recipient: jobId={} to={}",
                    notification.getJobId(), Recipients.mask(Channel.SMS, notification.getRecipient()));
            return ProviderResponses.invalidRecipient(providerName(), channel());
        }

        final String endpoint = baseUrl + "/2010-04-01/Accounts/" + accountSid + "/Messages.json";

        // HTTP Basic Auth: AccountSid:AuthToken
        final String credentials = Base64.getEncoder().encodeToString(
                (accountSid + ":" + authToken).getBytes(StandardCharsets.UTF_8));

        final FormBody form = new FormBody.Builder()
                .add("To",   Recipients.normalize(Channel.SMS, notification.getRecipient()))
                .add("From", fromNumber)
                .add("Body", smsText(notification.getBody()))
                .build();

        final Request request = new Request.Builder()
                .url(endpoint)
                .addHeader("Authorization", "Basic " + credentials)
                .post(form)
                .build();

        try (Response response = http.newCall(request).execute()) {
            final int    code     = response.code();
            final String respBody = response.body() != null ? response.body().string() : "";

            if (response.isSuccessful()) {
                final String sid = extractSid(respBody);
                LOG.info("Twilio SMS sent: jobId={} to={} sid={}",
                        notification.getJobId(), Recipients.mask(Channel.SMS, notification.getRecipient()), sid);
                return ProviderResult.builder(providerName(), channel()).success(sid, code).build();
            }
            LOG.warn("Twilio rejected SMS: jobId={} http={} body={}", notification.getJobId(), code, respBody);
            return ProviderResponses.failure(providerName(), channel(), code, respBody);
        } catch (IOException e) {
            LOG.error("Twilio IO error: jobId={} error={}", notification.getJobId(), e.getMessage());
            return ProviderResponses.ioFailure(providerName(), channel(), e);
        }
    }

    static String smsText(final String body) {
        final String text = body != null ? body.strip() : "";
        return text.length() <= MAX_SMS_LENGTH ? text : text.substring(0, MAX_SMS_LENGTH - 3) + "...";
    }

    private String extractSid(final String body) {
        try {
            return mapper.readTree(body).path("sid").asText("unknown");
        } catch (IOException e) {
            LOG.debug("Twilio response has no readable sid: {}", e.getMessage());
            return "unknown";
        }
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
