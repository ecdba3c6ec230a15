// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import javax.annotation.Nullable;

/**
 * The ways an access token for the Log Analytics API can be obtained.
 */
public enum AuthMode {
    /**
     * OAuth2 client-credentials grant using a tenant ID, client ID and client secret.
     */
    SERVICE_PRINCIPAL,

    /**
     * Token issued by the platform's local instance metadata endpoint. No secret is stored.
     */
    MANAGED_IDENTITY;

    /**
     * The pod identity value that selects {@link #MANAGED_IDENTITY}.
     */
    public static final String AZURE_POD_IDENTITY = "azure";

    /**
     * Selects the authentication mode from a pod identity provider name.
     *
     * @param podIdentity the pod identity provider, {@code null}, empty or {@code "none"} for a service principal
     * @return the matching authentication mode
     * @throws IllegalArgumentException if the pod identity provider isn't supported
     */
    public static AuthMode fromPodIdentity(@Nullable String podIdentity) {
        if (podIdentity == null || podIdentity.isEmpty() || "none".equals(podIdentity)) {
            return SERVICE_PRINCIPAL;
        }

        if (AZURE_POD_IDENTITY.equals(podIdentity)) {
            return MANAGED_IDENTITY;
        }

        throw new IllegalArgumentException(
                String.format("Log Analytics scaler doesn't support pod identity '%s'.", podIdentity));
    }
}
