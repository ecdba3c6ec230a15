// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.scaler;

import com.microsoft.loganalytics.auth.AuthMode;
import com.microsoft.loganalytics.auth.Credentials;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;

/**
 * The validated configuration of one Log Analytics scaler.
 * <p>
 * Use {@link #parse(Map, Map, Map, String)} to build it from the maps a scheduler hands to a scaler. Each value is
 * looked up in the authentication parameters first, then in the scaler metadata, and finally in the resolved
 * environment under the variable named by the metadata key with a {@code FromEnv} suffix. The query and threshold
 * are never read from the authentication parameters.
 */
public final class LogAnalyticsScalerMetadata {
    static final String TENANT_ID = "tenantId";
    static final String CLIENT_ID = "clientId";
    static final String CLIENT_SECRET = "clientSecret";
    static final String WORKSPACE_ID = "workspaceId";
    static final String QUERY = "query";
    static final String THRESHOLD = "threshold";
    static final String FROM_ENV_SUFFIX = "FromEnv";

    private final Credentials credentials;
    private final String workspaceId;
    private final String query;
    private final long threshold;

    /**
     * Creates the metadata from already validated values.
     *
     * @param credentials the credentials used to obtain access tokens
     * @param workspaceId the Log Analytics workspace to query
     * @param query the Kusto query returning the metric value and, optionally, a threshold
     * @param threshold the target value used when the query returns no threshold
     */
    public LogAnalyticsScalerMetadata(Credentials credentials, String workspaceId, String query, long threshold) {
        this.credentials = Helpers.throwIfArgumentNull(credentials, "credentials");
        this.workspaceId = Helpers.throwIfArgumentNullOrWhiteSpace(workspaceId, "workspaceId");
        this.query = Helpers.throwIfArgumentNullOrWhiteSpace(query, "query");
        this.threshold = threshold;
    }

    /**
     * Parses scaler configuration.
     *
     * @param resolvedEnv environment variables of the scaled workload, by name
     * @param metadata the scaler metadata
     * @param authParams parameters supplied by the authentication reference, may contain secrets
     * @param podIdentity the pod identity provider: {@code null}, empty or {@code "none"} for a service principal,
     *                    {@code "azure"} for managed identity
     * @return the validated metadata
     * @throws IllegalArgumentException if a required value is missing or malformed, or the pod identity isn't supported
     */
    public static LogAnalyticsScalerMetadata parse(
            @Nullable Map<String, String> resolvedEnv,
            @Nullable Map<String, String> metadata,
            @Nullable Map<String, String> authParams,
            @Nullable String podIdentity) {
        Map<String, String> env = resolvedEnv != null ? resolvedEnv : Collections.emptyMap();
        Map<String, String> meta = metadata != null ? metadata : Collections.emptyMap();
        Map<String, String> auth = authParams != null ? authParams : Collections.emptyMap();

        AuthMode authMode;
        try {
            authMode = AuthMode.fromPodIdentity(podIdentity);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Error parsing metadata. Details: Log Analytics Scaler doesn't support pod identity " + podIdentity, e);
        }

        Credentials credentials;
        switch (authMode) {
            case SERVICE_PRINCIPAL:
                credentials = Credentials.servicePrincipal(
                        getRequired(TENANT_ID, env, meta, auth),
                        getRequired(CLIENT_ID, env, meta, auth),
                        getRequired(CLIENT_SECRET, env, meta, auth));
                break;
            case MANAGED_IDENTITY:
                credentials = Credentials.managedIdentity();
                break;
            default:
                throw new IllegalArgumentException("Unexpected authentication mode: " + authMode);
        }

        String workspaceId = getRequired(WORKSPACE_ID, env, meta, auth);
        String query = getRequired(QUERY, env, meta, Collections.emptyMap());
        String thresholdText = getRequired(THRESHOLD, env, meta, Collections.emptyMap());

        long threshold;
        try {
            threshold = Long.parseLong(thresholdText.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Error parsing metadata. Details: can't parse threshold. Inner Error: " + e.getMessage(), e);
        }

        return new LogAnalyticsScalerMetadata(credentials, workspaceId, query, threshold);
    }

    private static String getRequired(String key, Map<String, String> env, Map<String, String> meta, Map<String, String> auth) {
        String value = auth.get(key);
        if (!Helpers.isNullOrEmpty(value)) {
            return value;
        }

        value = meta.get(key);
        if (!Helpers.isNullOrEmpty(value)) {
            return value;
        }

        String envName = meta.get(key + FROM_ENV_SUFFIX);
        if (!Helpers.isNullOrEmpty(envName)) {
            value = env.get(envName);
            if (Helpers.isNullOrEmpty(value)) {
                throw new IllegalArgumentException(String.format(
                        "Error parsing metadata. Details: %s refers to environment variable %s, which is not set or empty. Check your ScaledObject configuration",
                        key + FROM_ENV_SUFFIX, envName));
            }
            return value;
        }

        throw new IllegalArgumentException(String.format(
                "Error parsing metadata. Details: %s was not found in metadata. Check your ScaledObject configuration", key));
    }

    public Credentials getCredentials() {
        return this.credentials;
    }

    public AuthMode getAuthMode() {
        return this.credentials.getAuthMode();
    }

    public String getWorkspaceId() {
        return this.workspaceId;
    }

    public String getQuery() {
        return this.query;
    }

    /**
     * Gets the configured threshold, used as the scaling target when the query doesn't return one.
     *
     * @return the default threshold
     */
    public long getThreshold() {
        return this.threshold;
    }

    @Override
    public String toString() {
        return "LogAnalyticsScalerMetadata{credentials=" + this.credentials
                + ", workspaceId=" + this.workspaceId
                + ", threshold=" + this.threshold + "}";
    }
}
