// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

/**
 * The metric value and threshold last read by one scaler. Both are {@code -1} until the first query succeeds.
 * Not thread-safe; a scaler is driven by one caller at a time.
 */
final class SessionCache {
    static final long UNSET = -1;

    private long metricValue = UNSET;
    private long metricThreshold = UNSET;

    boolean isPopulated() {
        return this.metricValue >= 0;
    }

    void update(long metricValue, long metricThreshold) {
        this.metricValue = metricValue;
        this.metricThreshold = metricThreshold;
    }

    void clear() {
        this.metricValue = UNSET;
        this.metricThreshold = UNSET;
    }

    long getMetricValue() {
        return this.metricValue;
    }

    long getMetricThreshold() {
        return this.metricThreshold;
    }
}
