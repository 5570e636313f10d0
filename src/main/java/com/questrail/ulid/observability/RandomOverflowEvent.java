package com.questrail.ulid.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Every random value for millisecond {@code time} has been issued.
 */
public record RandomOverflowEvent(Instant time) {
    public RandomOverflowEvent {
        Objects.requireNonNull(time, "time");
    }
}
