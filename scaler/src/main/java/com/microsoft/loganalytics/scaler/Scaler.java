// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import java.util.List;

/**
 * Pull-based contract through which an autoscaler reads a scaling signal.
 * <p>
 * The scheduler asks whether the workload should be active at all, which metric to target and at what value, and
 * what the metric currently reads. Implementations should be closed when they are no longer needed.
 */
public interface Scaler extends AutoCloseable {

    /**
     * Checks whether the workload should be scaled above zero.
     *
     * @return {@code true} if the metric value is greater than zero
     */
    boolean isActive();

    /**
     * Describes the metric to scale on and its target value.
     *
     * @return the metric specifications, or an empty list if they can't be determined right now
     */
    List<ExternalMetricSpec> getMetricSpecForScaling();

    /**
     * Reads the current value of a metric.
     *
     * @param metricName the name reported by {@link #getMetricSpecForScaling()}
     * @return the current metric values
     */
    List<ExternalMetricValue> getMetrics(String metricName);

    /**
     * Releases resources held by this scaler.
     */
    @Override
    void close();
}
