package com.eci.notification.management;

import java.util.function.BooleanSupplier;

/**
 * One component reported by the health endpoints.
 */
public interface HealthCheck {

    String name();

    /** Must return quickly and never throw. */
    boolean isHealthy();

    static HealthCheck of(final String name, final BooleanSupplier probe) {
        return new HealthCheck() {
            @Override public String  name()      { return name; }
            @Override public boolean isHealthy() { return probe.getAsBoolean(); }
        };
    }
}
