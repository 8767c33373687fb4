package com.eci.notification.store;

import com.eci.notification.model.Channel;
import com.eci.notification.model.JobState;
import com.eci.notification.model.NotificationJob;

/**
 * Filter for {@link NotificationStateStore#query}. Null fields match
 * everything; results are newest first. {@code offset} skips that many
 * matches before the page of {@code limit} starts.
 */
public record JobQuery(JobState state, Channel channel, String eventType, String sourceEventId,
                       int limit, int offset) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT     = 100;

    public JobQuery {
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (limit > MAX_LIMIT) limit = MAX_LIMIT;
        if (offset < 0) offset = 0;
    }

    public JobQuery(final JobState state, final Channel channel, final String eventType,
                    final String sourceEventId, final int limit) {
        this(state, channel, eventType, sourceEventId, limit, 0);
    }

    public static JobQuery all() {
        return new JobQuery(null, null, null, null, DEFAULT_LIMIT);
    }

    public boolean matches(final NotificationJob job) {
        return (state == null || job.getState() == state)
            && (channel == null || job.getChannel() == channel)
            && (eventType == null || eventType.equals(job.getEventType()))
            && (sourceEventId == null || sourceEventId.equals(job.getSourceEventId()));
    }
}
