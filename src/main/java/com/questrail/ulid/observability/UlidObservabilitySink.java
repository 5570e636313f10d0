package com.questrail.ulid.observability;

/**
 * Receives anomalies observed while generating ULIDs.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface UlidObservabilitySink {
    /**
     * Called when the wall clock reports a time earlier than the last issued ULID.
     * @param event the regression details
     */
    void onClockRegression(ClockRegressionEvent event);

    /**
     * Called when the random part cannot be incremented within the current millisecond.
     * @param event the overflow details
     */
    void onRandomOverflow(RandomOverflowEvent event);
}
