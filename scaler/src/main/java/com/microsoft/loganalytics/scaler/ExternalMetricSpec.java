// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import java.util.Objects;

/**
 * An external metric to scale on, targeted as an average value per replica.
 */
public final class ExternalMetricSpec {
    private final String metricName;
    private final long targetAverageValue;

    public ExternalMetricSpec(String metricName, long targetAverageValue) {
        this.metricName = Helpers.throwIfArgumentNullOrWhiteSpace(metricName, "metricName");
        this.targetAverageValue = targetAverageValue;
    }

    public String getMetricName() {
        return this.metricName;
    }

    public long getTargetAverageValue() {
        return this.targetAverageValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExternalMetricSpec that = (ExternalMetricSpec) o;
        return this.targetAverageValue == that.targetAverageValue && this.metricName.equals(that.metricName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.metricName, this.targetAverageValue);
    }

    @Override
    public String toString() {
        return "ExternalMetricSpec{metricName=" + this.metricName + ", targetAverageValue=" + this.targetAverageValue + "}";
    }
}
