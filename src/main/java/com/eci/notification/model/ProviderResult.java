package com.eci.notification.model;

import java.time.Instant;

/**
 * Immutable, classified outcome of a single provider send.
 *
 * <p>Returned by every {@link com.eci.notification.channel.ChannelProvider}.
 * The {@code providerMessageId} is the external reference returned by the
 * provider (SendGrid message ID, Twilio SID).
 */
public final class ProviderResult {

    public enum Status { SUCCESS, RETRYABLE_FAILURE, PERMANENT_FAILURE }

    private final Status  status;
    private final String  provider;
    private final Channel channel;
    private final String  providerMessageId; // null on failure
    private final String  errorMessage;      // null on success
    private final int     responseCode;      // 0 if not applicable
    private final Instant completedAt;

    private ProviderResult(final Builder b) {
        this.status            = b.status;
        this.provider          = b.provider;
        this.channel           = b.channel;
        this.providerMessageId = b.providerMessageId;
        this.errorMessage      = b.errorMessage;
        this.responseCode      = b.responseCode;
        this.completedAt       = Instant.now();
    }

    public static Builder builder(final String provider, final Channel channel) {
        return new Builder(provider, channel);
    }

    public static final class Builder {
        private final String  provider;
        private final Channel channel;
        private Status status = Status.RETRYABLE_FAILURE;
        private String providerMessageId;
        private String errorMessage;
        private int    responseCode;

        private Builder(final String provider, final Channel channel) {
            this.provider = provider;
            this.channel  = channel;
        }

        public Builder success(final String messageId, final int code) {
            this.status            = Status.SUCCESS;
            this.providerMessageId = messageId;
            this.responseCode      = code;
            return this;
        }

        public Builder retryable(final String error, final int code) {
            this.status       = Status.RETRYABLE_FAILURE;
            this.errorMessage = error;
            this.responseCode = code;
            return this;
        }

        public Builder permanent(final String error, final int code) {
            this.status       = Status.PERMANENT_FAILURE;
            this.errorMessage = error;
            this.responseCode = code;
            return this;
        }

        public ProviderResult build() { return new ProviderResult(this); }
    }

    public Status  getStatus()            { return status; }
    public String  getProvider()          { return provider; }
    public Channel getChannel()           { return channel; }
    public String  getProviderMessageId() { return providerMessageId; }
    public String  getErrorMessage()      { return errorMessage; }
    public int     getResponseCode()      { return responseCode; }
    public Instant getCompletedAt()       { return completedAt; }
    public boolean isSuccess()            { return status == Status.SUCCESS; }

    /** The error kind this outcome maps to, or {@code null} on success. */
    public ErrorKind errorKind() {
        return switch (status) {
            case SUCCESS           -> null;
            case RETRYABLE_FAILURE -> ErrorKind.RETRYABLE_FAILURE;
            case PERMANENT_FAILURE -> ErrorKind.PERMANENT_FAILURE;
        };
    }

    @Override
    public String toString() {
        return "ProviderResult{provider=" + provider
             + ", channel=" + channel
             + ", status=" + status
             + (providerMessageId != null ? ", msgId=" + providerMessageId : "")
             + (errorMessage != null ? ", error=" + errorMessage : "")
             + (responseCode > 0 ? ", code=" + responseCode : "")
             + "}";
    }
}
