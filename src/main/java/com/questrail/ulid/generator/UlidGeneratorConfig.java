package com.questrail.ulid.generator;

import com.questrail.ulid.api.UlidRng;
import com.questrail.ulid.observability.NullObservabilitySink;
import com.questrail.ulid.observability.UlidObservabilitySink;
import com.questrail.ulid.rng.SecureUlidRng;
import com.questrail.ulid.time.SystemWallClock;
import com.questrail.ulid.time.WallClock;

import java.util.Objects;

/**
 * Collaborators of a {@link MonotonicUlidGenerator}.
 */
public record UlidGeneratorConfig(
    WallClock clock,
    UlidRng rng,
    UlidObservabilitySink observabilitySink
) {
    public UlidGeneratorConfig {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(rng, "rng");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * System clock, {@link SecureUlidRng}, no observability.
     */
    public static UlidGeneratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WallClock clock = SystemWallClock.INSTANCE;
        private UlidRng rng;
        private UlidObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withRng(UlidRng rng) {
            this.rng = rng;
            return this;
        }

        public Builder withObservabilitySink(UlidObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public UlidGeneratorConfig build() {
            return new UlidGeneratorConfig(
                clock,
                (rng != null) ? rng : new SecureUlidRng(),
                observabilitySink);
        }
    }
}
