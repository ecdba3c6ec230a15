// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import com.azure.core.http.HttpClient;

/**
 * Obtains a fresh access token from an identity provider.
 * <p>
 * Implementations never cache; caching and refresh decisions belong to {@link AccessTokenCache}.
 */
public interface AuthProvider {
    /**
     * Requests a new token from the identity provider.
     *
     * @return the new token
     * @throws AuthenticationException if the identity provider can't be reached, rejects the request or returns a
     *                                 body that can't be decoded into a token
     */
    AuthToken fetchToken();

    /**
     * Gets the authentication mode implemented by this provider.
     *
     * @return the authentication mode
     */
    AuthMode getAuthMode();

    /**
     * Creates the provider matching the mode of the given credentials.
     *
     * @param credentials the credentials to authenticate with
     * @param httpClient the client used to reach the identity provider
     * @param endpoints the identity provider endpoints
     * @return a provider for the credentials' authentication mode
     */
    static AuthProvider create(Credentials credentials, HttpClient httpClient, AuthEndpoints endpoints) {
        Helpers.throwIfArgumentNull(credentials, "credentials");
        switch (credentials.getAuthMode()) {
            case SERVICE_PRINCIPAL:
                return new ServicePrincipalAuthProvider(credentials, httpClient, endpoints);
            case MANAGED_IDENTITY:
                return new ManagedIdentityAuthProvider(httpClient, endpoints);
            default:
                throw new IllegalArgumentException("Unsupported authentication mode: " + credentials.getAuthMode());
        }
    }
}
