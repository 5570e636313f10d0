package com.questrail.ulid.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * The wall clock reported {@code observed} after a ULID had already been
 * issued for the later time {@code lastIssued}.
 */
public record ClockRegressionEvent(Instant lastIssued, Instant observed) {
    public ClockRegressionEvent {
        Objects.requireNonNull(lastIssued, "lastIssued");
        Objects.requireNonNull(observed, "observed");
    }

    public long regressionMillis() {
        return lastIssued.toEpochMilli() - observed.toEpochMilli();
    }
}
