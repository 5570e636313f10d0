package com.questrail.ulid.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of UlidObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jUlidObservabilitySink implements UlidObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jUlidObservabilitySink.class);

    @Override
    public void onClockRegression(ClockRegressionEvent event) {
        log.warn("Wall clock moved backwards by {} ms: last issued {}, observed {}",
            event.regressionMillis(),
            event.lastIssued(),
            event.observed());
    }

    @Override
    public void onRandomOverflow(RandomOverflowEvent event) {
        log.error("ULID random part exhausted for {}", event.time());
    }
}
