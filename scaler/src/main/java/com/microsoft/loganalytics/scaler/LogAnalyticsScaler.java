// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.azure.core.http.HttpClient;
import com.microsoft.loganalytics.auth.AccessTokenCache;
import com.microsoft.loganalytics.auth.AuthEndpoints;
import com.microsoft.loganalytics.auth.AuthProvider;
import com.microsoft.loganalytics.auth.LogAnalyticsException;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Scaler} driven by the result of an Azure Log Analytics query.
 * <p>
 * The first of {@link #isActive()} and {@link #getMetricSpecForScaling()} runs the query and remembers the value and
 * threshold; later calls reuse them until {@link #invalidateCache()} is called. {@link #getMetrics(String)} always
 * runs the query again. Instances are meant to be created for each scheduling cycle and are not thread-safe; the
 * {@link com.microsoft.loganalytics.auth.TokenStore} they share is.
 */
public final class LogAnalyticsScaler implements Scaler {
    static final String METRIC_NAME_PREFIX = "azure-log-analytics";

    private static final Logger logger = Logger.getLogger(LogAnalyticsScaler.class.getPackage().getName());

    private final LogAnalyticsScalerMetadata metadata;
    private final LogAnalyticsQueryExecutor queryExecutor;
    private final SessionCache cache = new SessionCache();
    private final Clock clock;
    private final String scaledObjectName;
    private final String namespace;
    private final String metricName;

    LogAnalyticsScaler(LogAnalyticsScalerBuilder builder) {
        this.metadata = Helpers.throwIfArgumentNull(builder.metadata, "metadata");
        Helpers.throwIfArgumentNull(builder.tokenStore, "tokenStore");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.scaledObjectName = builder.scaledObjectName != null ? builder.scaledObjectName : "";
        this.namespace = builder.namespace != null ? builder.namespace : "";

        HttpClient httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.createDefault();
        AuthEndpoints authEndpoints = builder.authEndpoints != null ? builder.authEndpoints : new AuthEndpoints();
        AuthProvider authProvider = AuthProvider.create(this.metadata.getCredentials(), httpClient, authEndpoints);
        AccessTokenCache tokenCache = new AccessTokenCache(
                builder.tokenStore, authProvider, this.metadata.getCredentials(), this.clock);
        this.queryExecutor = new LogAnalyticsQueryExecutor(
                tokenCache, httpClient, builder.queryEndpoint, this.metadata.getWorkspaceId());

        this.metricName = normalizeMetricName(METRIC_NAME_PREFIX + "-" + this.metadata.getWorkspaceId());

        logger.log(Level.INFO, "Created Log Analytics scaler for scaled object {0} in namespace {1} using {2}.",
                new Object[]{this.scaledObjectName, this.namespace, this.metadata.getAuthMode()});
    }

    /**
     * Creates a new builder.
     *
     * @return a new {@link LogAnalyticsScalerBuilder}
     */
    public static LogAnalyticsScalerBuilder builder() {
        return new LogAnalyticsScalerBuilder();
    }

    /**
     * {@inheritDoc}
     *
     * @throws LogAnalyticsException if the query fails or its result is invalid
     */
    @Override
    public boolean isActive() {
        ensureFresh();
        return this.cache.getMetricValue() > 0;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Errors are logged and result in an empty list.
     */
    @Override
    public List<ExternalMetricSpec> getMetricSpecForScaling() {
        try {
            ensureFresh();
        } catch (LogAnalyticsException e) {
            logger.log(Level.FINE, String.format(
                    "Failed to get metric spec. Scaled object: %s. Namespace: %s.", this.scaledObjectName, this.namespace), e);
            return Collections.emptyList();
        }

        return Collections.singletonList(new ExternalMetricSpec(this.metricName, this.cache.getMetricThreshold()));
    }

    /**
     * {@inheritDoc}
     *
     * @throws LogAnalyticsException if the query fails or its result is invalid
     */
    @Override
    public List<ExternalMetricValue> getMetrics(String metricName) {
        Helpers.throwIfArgumentNullOrWhiteSpace(metricName, "metricName");

        MetricSample sample = this.queryExecutor.executeQuery(this.metadata.getQuery());
        logger.fine(() -> String.format(
                "Provided metric value %d for %s. Scaled object: %s. Namespace: %s.",
                sample.getValue(), metricName, this.scaledObjectName, this.namespace));
        return Collections.singletonList(new ExternalMetricValue(metricName, sample.getValue(), this.clock.instant()));
    }

    /**
     * Forgets the cached metric value and threshold so that the next {@link #isActive()} or
     * {@link #getMetricSpecForScaling()} runs the query again.
     */
    public void invalidateCache() {
        this.cache.clear();
    }

    /**
     * Gets the external metric name reported by {@link #getMetricSpecForScaling()}.
     *
     * @return the metric name
     */
    public String getMetricName() {
        return this.metricName;
    }

    @Override
    public void close() {
        // nothing to release
    }

    private void ensureFresh() {
        if (this.cache.isPopulated()) {
            return;
        }

        MetricSample sample = this.queryExecutor.executeQuery(this.metadata.getQuery());
        long threshold = sample.getThreshold() > 0 ? sample.getThreshold() : this.metadata.getThreshold();
        this.cache.update(sample.getValue(), threshold);
    }

    static String normalizeMetricName(String name) {
        return name.replace('/', '-')
                .replace('.', '-')
                .replace(':', '-')
                .replace('%', '-');
    }
}
