// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import java.time.Instant;
import java.util.Objects;

/**
 * A reading of an external metric at a point in time.
 */
public final class ExternalMetricValue {
    private final String metricName;
    private final long value;
    private final Instant timestamp;

    public ExternalMetricValue(String metricName, long value, Instant timestamp) {
        this.metricName = Helpers.throwIfArgumentNullOrWhiteSpace(metricName, "metricName");
        this.value = value;
        this.timestamp = Helpers.throwIfArgumentNull(timestamp, "timestamp");
    }

    public String getMetricName() {
        return this.metricName;
    }

    public long getValue() {
        return this.value;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExternalMetricValue that = (ExternalMetricValue) o;
        return this.value == that.value
                && this.metricName.equals(that.metricName)
                && this.timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.metricName, this.value, this.timestamp);
    }

    @Override
    public String toString() {
        return "ExternalMetricValue{metricName=" + this.metricName + ", value=" + this.value + ", timestamp=" + this.timestamp + "}";
    }
}
