package com.questrail.ulid.observability;

/**
 * No-op implementation of UlidObservabilitySink.
 */
public final class NullObservabilitySink implements UlidObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onClockRegression(ClockRegressionEvent event) {}

    @Override
    public void onRandomOverflow(RandomOverflowEvent event) {}
}
