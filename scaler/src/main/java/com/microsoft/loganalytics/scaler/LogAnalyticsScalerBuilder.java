// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.azure.core.http.HttpClient;
import com.microsoft.loganalytics.auth.AuthEndpoints;
import com.microsoft.loganalytics.auth.TokenStore;

import java.time.Clock;

/**
 * Builder class for constructing new {@link LogAnalyticsScaler} objects.
 */
public final class LogAnalyticsScalerBuilder {
    LogAnalyticsScalerMetadata metadata;
    TokenStore tokenStore;
    HttpClient httpClient;
    String scaledObjectName = "";
    String namespace = "";
    AuthEndpoints authEndpoints;
    String queryEndpoint = LogAnalyticsQueryExecutor.DEFAULT_QUERY_ENDPOINT;
    Clock clock;

    /**
     * Sets the validated scaler configuration. Required.
     *
     * @param metadata the scaler configuration
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder metadata(LogAnalyticsScalerMetadata metadata) {
        this.metadata = metadata;
        return this;
    }

    /**
     * Sets the token store shared by all scalers in the process. Required.
     * <p>
     * Scalers with the same credentials reuse each other's tokens through this store.
     *
     * @param tokenStore the shared token store
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder tokenStore(TokenStore tokenStore) {
        this.tokenStore = tokenStore;
        return this;
    }

    /**
     * Sets the HTTP client used for identity and query requests. If not specified,
     * {@link HttpClient#createDefault()} is used.
     *
     * @param httpClient the HTTP client
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder httpClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        return this;
    }

    /**
     * Sets the name of the scaled object, used in log messages.
     *
     * @param scaledObjectName the scaled object name
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder scaledObjectName(String scaledObjectName) {
        this.scaledObjectName = scaledObjectName;
        return this;
    }

    /**
     * Sets the namespace of the scaled object, used in log messages.
     *
     * @param namespace the namespace
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder namespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    /**
     * Overrides the endpoints used to obtain access tokens. Defaults target the Azure public cloud.
     *
     * @param authEndpoints the identity endpoints
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder authEndpoints(AuthEndpoints authEndpoints) {
        this.authEndpoints = authEndpoints;
        return this;
    }

    /**
     * Overrides the Log Analytics API host. Defaults to {@value LogAnalyticsQueryExecutor#DEFAULT_QUERY_ENDPOINT}.
     *
     * @param queryEndpoint the API host
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder queryEndpoint(String queryEndpoint) {
        this.queryEndpoint = queryEndpoint;
        return this;
    }

    /**
     * Sets the clock used for token expiry checks and metric timestamps. Defaults to the UTC system clock.
     *
     * @param clock the clock
     * @return this builder object
     */
    public LogAnalyticsScalerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Initializes a new {@link LogAnalyticsScaler} object with the settings specified in the current builder object.
     *
     * @return a new {@link LogAnalyticsScaler} object
     * @throws IllegalArgumentException if the metadata or token store wasn't specified, or the query endpoint isn't
     *                                  an absolute http or https URL
     */
    public LogAnalyticsScaler build() {
        return new LogAnalyticsScaler(this);
    }
}
