package com.eci.notification.model;

/**
 * A fully rendered message handed to a
 * {@link com.eci.notification.channel.ChannelProvider}.
 */
public final class RenderedNotification {

    private final String  jobId;
    private final String  eventType;
    private final Channel channel;
    private final String  recipient;
    private final String  subject;
    private final String  body;

    public RenderedNotification(
            final String jobId,
            final String eventType,
            final Channel channel,
            final String recipient,
            final String subject,
            final String body) {
        this.jobId     = jobId;
        this.eventType = eventType;
        this.channel   = channel;
        this.recipient = recipient;
        this.subject   = subject;
        this.body      = body;
    }

    public static RenderedNotification of(final NotificationJob job) {
        return new RenderedNotification(
                job.getJobId(), job.getEventType(), job.getChannel(),
                job.getRecipient(), job.getRenderedSubject(), job.getRenderedBody());
    }

    public String  getJobId()     { return jobId; }
    public String  getEventType() { return eventType; }
    public Channel getChannel()   { return channel; }
    public String  getRecipient() { return recipient; }
    public String  getSubject()   { return subject; }
    public String  getBody()      { return body; }

    @Override
    public String toString() {
        return "RenderedNotification{job=" + jobId + ", type=" + eventType + ", channel=" + channel + "}";
    }
}
