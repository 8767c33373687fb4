package com.eci.notification.engine;

@FunctionalInterface
public interface JobProcessor {

    ProcessOutcome process(String jobId);
}
