package com.eci.notification.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of delivery work derived from an {@link Event}: one channel, one
 * recipient.
 *
 * <p>Instances are immutable. State changes go through
 * {@link #transitionTo(JobState, Instant)} which enforces the forward-only
 * lifecycle of {@link JobState}; other field changes use {@link #toBuilder()}.
 */
public final class NotificationJob {

    private final String              jobId;
    private final String              sourceEventId;
    private final String              eventType;
    private final String              dedupKey;
    private final Channel             channel;
    private final String              recipient;
    private final String              locale;
    private final Map<String, String> payload;
    private final String              templateId;
    private final String              renderedSubject;
    private final String              renderedBody;
    private final JobState            state;
    private final int                 attemptCount;
    private final ErrorKind           errorKind;
    private final String              lastError;
    private final String              providerMessageId;
    private final Instant             createdAt;
    private final Instant             updatedAt;
    private final Instant             lastAttemptAt;
    private final Instant             nextRetryAt;
    private final Instant             deliveredAt;

    private NotificationJob(final Builder b) {
        this.jobId             = b.jobId;
        this.sourceEventId     = b.sourceEventId;
        this.eventType         = b.eventType;
        this.dedupKey          = b.dedupKey;
        this.channel           = b.channel;
        this.recipient         = b.recipient;
        this.locale            = b.locale;
        this.payload           = Collections.unmodifiableMap(new LinkedHashMap<>(b.payload));
        this.templateId        = b.templateId;
        this.renderedSubject   = b.renderedSubject;
        this.renderedBody      = b.renderedBody;
        this.state             = b.state;
        this.attemptCount      = b.attemptCount;
        this.errorKind         = b.errorKind;
        this.lastError         = b.lastError;
        this.providerMessageId = b.providerMessageId;
        this.createdAt         = b.createdAt;
        this.updatedAt         = b.updatedAt != null ? b.updatedAt : b.createdAt;
        this.lastAttemptAt     = b.lastAttemptAt;
        this.nextRetryAt       = b.nextRetryAt;
        this.deliveredAt       = b.deliveredAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        final Builder b = new Builder();
        b.jobId             = jobId;
        b.sourceEventId     = sourceEventId;
        b.eventType         = eventType;
        b.dedupKey          = dedupKey;
        b.channel           = channel;
        b.recipient         = recipient;
        b.locale            = locale;
        b.payload           = new LinkedHashMap<>(payload);
        b.templateId        = templateId;
        b.renderedSubject   = renderedSubject;
        b.renderedBody      = renderedBody;
        b.state             = state;
        b.attemptCount      = attemptCount;
        b.errorKind         = errorKind;
        b.lastError         = lastError;
        b.providerMessageId = providerMessageId;
        b.createdAt         = createdAt;
        b.updatedAt         = updatedAt;
        b.lastAttemptAt     = lastAttemptAt;
        b.nextRetryAt       = nextRetryAt;
        b.deliveredAt       = deliveredAt;
        return b;
    }

    /**
     * Returns a builder for this job moved to {@code next}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public Builder transitionTo(final JobState next, final Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition " + state + " -> " + next + " for job " + jobId);
        }
        return toBuilder().state(next).updatedAt(now);
    }

    public static final class Builder {
        private String              jobId;
        private String              sourceEventId;
        private String              eventType;
        private String              dedupKey;
        private Channel             channel;
        private String              recipient;
        private String              locale;
        private Map<String, String> payload = new LinkedHashMap<>();
        private String              templateId;
        private String              renderedSubject;
        private String              renderedBody;
        private JobState            state = JobState.PENDING;
        private int                 attemptCount;
        private ErrorKind           errorKind;
        private String              lastError;
        private String              providerMessageId;
        private Instant             createdAt;
        private Instant             updatedAt;
        private Instant             lastAttemptAt;
        private Instant             nextRetryAt;
        private Instant             deliveredAt;

        private Builder() { }

        public Builder jobId(final String v)             { this.jobId = v;             return this; }
        public Builder sourceEventId(final String v)     { this.sourceEventId = v;     return this; }
        public Builder eventType(final String v)         { this.eventType = v;         return this; }
        public Builder dedupKey(final String v)          { this.dedupKey = v;          return this; }
        public Builder channel(final Channel v)          { this.channel = v;           return this; }
        public Builder recipient(final String v)         { this.recipient = v;         return this; }
        public Builder locale(final String v)            { this.locale = v;            return this; }
        public Builder templateId(final String v)        { this.templateId = v;        return this; }
        public Builder renderedSubject(final String v)   { this.renderedSubject = v;   return this; }
        public Builder renderedBody(final String v)      { this.renderedBody = v;      return this; }
        public Builder attemptCount(final int v)         { this.attemptCount = v;      return this; }
        public Builder errorKind(final ErrorKind v)      { this.errorKind = v;         return this; }
        public Builder lastError(final String v)         { this.lastError = v;         return this; }
        public Builder providerMessageId(final String v) { this.providerMessageId = v; return this; }
        public Builder createdAt(final Instant v)        { this.createdAt = v;         return this; }
        public Builder updatedAt(final Instant v)        { this.updatedAt = v;         return this; }
        public Builder lastAttemptAt(final Instant v)    { this.lastAttemptAt = v;     return this; }
        public Builder nextRetryAt(final Instant v)      { this.nextRetryAt = v;       return this; }
        public Builder deliveredAt(final Instant v)      { this.deliveredAt = v;       return this; }

        public Builder payload(final Map<String, String> v) {
            this.payload = v != null ? new LinkedHashMap<>(v) : new LinkedHashMap<>();
            return this;
        }

        Builder state(final JobState v) {
            this.state = v;
            return this;
        }

        /** Marks the job as failed with the given classification. */
        public Builder failed(final ErrorKind kind, final String error) {
            this.errorKind = kind;
            this.lastError = error;
            this.nextRetryAt = null;
            return this;
        }

        public NotificationJob build() {
            if (jobId == null || dedupKey == null || channel == null || createdAt == null) {
                throw new IllegalStateException("jobId, dedupKey, channel and createdAt are required");
            }
            return new NotificationJob(this);
        }
    }

    public String              getJobId()             { return jobId; }
    public String              getSourceEventId()     { return sourceEventId; }
    public String              getEventType()         { return eventType; }
    public String              getDedupKey()          { return dedupKey; }
    public Channel             getChannel()           { return channel; }
    public String              getRecipient()         { return recipient; }
    public String              getLocale()            { return locale; }
    public Map<String, String> getPayload()           { return payload; }
    public String              getTemplateId()        { return templateId; }
    public String              getRenderedSubject()   { return renderedSubject; }
    public String              getRenderedBody()      { return renderedBody; }
    public JobState            getState()             { return state; }
    public int                 getAttemptCount()      { return attemptCount; }
    public ErrorKind           getErrorKind()         { return errorKind; }
    public String              getLastError()         { return lastError; }
    public String              getProviderMessageId() { return providerMessageId; }
    public Instant             getCreatedAt()         { return createdAt; }
    public Instant             getUpdatedAt()         { return updatedAt; }
    public Instant             getLastAttemptAt()     { return lastAttemptAt; }
    public Instant             getNextRetryAt()       { return nextRetryAt; }
    public Instant             getDeliveredAt()       { return deliveredAt; }

    public boolean isRendered() {
        return renderedBody != null;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    @Override
    public String toString() {
        return "NotificationJob{id=" + jobId
             + ", event=" + sourceEventId
             + ", type=" + eventType
             + ", channel=" + channel
             + ", state=" + state
             + ", attempts=" + attemptCount
             + (errorKind != null ? ", error=" + errorKind : "")
             + "}";
    }
}
