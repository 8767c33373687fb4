package com.eci.notification.engine;

/**
 * Hands job ids to whatever executes them.
 */
public interface JobQueue {

    /**
     * Schedule {@code jobId} for processing. Ids already waiting or running
     * are ignored.
     */
    void enqueue(String jobId);
}
