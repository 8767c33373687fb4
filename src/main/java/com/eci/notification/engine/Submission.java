package com.eci.notification.engine;

import com.eci.notification.model.Channel;
import com.eci.notification.model.JobState;

/**
 * Result of submitting one (event, channel, recipient) triple.
 */
public record Submission(Status status, String jobId, JobState state, Channel channel) {

    public enum Status {
        /** A new job was created and queued. */
        ACCEPTED,
        /** A job for the same dedup key is still being worked on. */
        IN_PROGRESS,
        /** The dedup key was already delivered; nothing was sent. */
        ALREADY_DELIVERED
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
