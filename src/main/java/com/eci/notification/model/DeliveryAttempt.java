package com.eci.notification.model;

import java.time.Instant;

/**
 * One row of the append-only delivery audit trail. A job's
 * {@code attemptCount} always equals the number of its attempt rows.
 */
public final class DeliveryAttempt {

    private final String    jobId;
    private final int       attemptNo;
    private final String    provider;
    private final int       providerResponseCode;  // 0 if not applicable
    private final boolean   succeeded;
    private final ErrorKind errorKind;             // null on success
    private final String    errorMessage;          // null on success
    private final Instant   timestamp;
    private final long      durationMs;

    public DeliveryAttempt(
            final String jobId,
            final int attemptNo,
            final ProviderResult result,
            final Instant timestamp,
            final long durationMs) {
        this.jobId                = jobId;
        this.attemptNo            = attemptNo;
        this.provider             = result.getProvider();
        this.providerResponseCode = result.getResponseCode();
        this.succeeded            = result.isSuccess();
        this.errorKind            = result.errorKind();
        this.errorMessage         = result.getErrorMessage();
        this.timestamp            = timestamp;
        this.durationMs           = durationMs;
    }

    public String    getJobId()                { return jobId; }
    public int       getAttemptNo()            { return attemptNo; }
    public String    getProvider()             { return provider; }
    public int       getProviderResponseCode() { return providerResponseCode; }
    public boolean   isSucceeded()             { return succeeded; }
    public ErrorKind getErrorKind()            { return errorKind; }
    public String    getErrorMessage()         { return errorMessage; }
    public Instant   getTimestamp()            { return timestamp; }
    public long      getDurationMs()           { return durationMs; }

    @Override
    public String toString() {
        return "DeliveryAttempt{job=" + jobId
             + ", no=" + attemptNo
             + ", provider=" + provider
             + ", succeeded=" + succeeded
             + (errorKind != null ? ", error=" + errorKind : "")
             + (providerResponseCode > 0 ? ", code=" + providerResponseCode : "")
             + "}";
    }
}
