// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

/**
 * A metric value read from a query result, with the threshold the query supplied for it, if any.
 */
public final class MetricSample {
    /**
     * Threshold value meaning that the query didn't return a threshold column.
     */
    public static final long NO_THRESHOLD = -1;

    private final long value;
    private final long threshold;

    public MetricSample(long value, long threshold) {
        this.value = value;
        this.threshold = threshold;
    }

    public long getValue() {
        return this.value;
    }

    /**
     * Gets the threshold returned by the query.
     *
     * @return the threshold, or {@link #NO_THRESHOLD} if the configured default applies
     */
    public long getThreshold() {
        return this.threshold;
    }

    boolean hasThreshold() {
        return this.threshold != NO_THRESHOLD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MetricSample that = (MetricSample) o;
        return this.value == that.value && this.threshold == that.threshold;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(this.value) + Long.hashCode(this.threshold);
    }

    @Override
    public String toString() {
        return "MetricSample{value=" + this.value + ", threshold=" + this.threshold + "}";
    }
}
