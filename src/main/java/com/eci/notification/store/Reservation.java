package com.eci.notification.store;

/**
 * Result of {@link IdempotencyStore#checkAndReserve}.
 *
 * @param status outcome of the reserve attempt
 * @param jobId  the job now holding the key: the caller's job when
 *               {@code FRESH}, otherwise the job that delivered it or is
 *               sending it
 */
public record Reservation(Status status, String jobId) {

    public enum Status {
        /** The caller owns the key until it marks it delivered or releases it. */
        FRESH,
        ALREADY_DELIVERED,
        /** Another worker holds an unexpired lease on the key. */
        IN_FLIGHT
    }

    public static Reservation fresh(final String jobId)     { return new Reservation(Status.FRESH, jobId); }
    public static Reservation delivered(final String jobId) { return new Reservation(Status.ALREADY_DELIVERED, jobId); }
    public static Reservation inFlight(final String jobId)  { return new Reservation(Status.IN_FLIGHT, jobId); }
}
